package work.lcod.forge.packages;

import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.git.Tag;

/**
 * Latest release of a package.
 *
 * @param version released version, {@value #NO_RELEASE} when no release tag exists
 * @param tag release tag, empty when no release tag exists
 */
public record Release(String version, Optional<Tag> tag) {
    public static final String NO_RELEASE = "0.0.0";

    public Release {
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(tag, "tag");
    }

    public static Release none() {
        return new Release(NO_RELEASE, Optional.empty());
    }

    public static Release of(String version, Tag tag) {
        return new Release(version, Optional.of(tag));
    }
}
