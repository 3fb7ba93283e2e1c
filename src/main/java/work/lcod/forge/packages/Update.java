package work.lcod.forge.packages;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.conventional.ConventionalCommit;
import work.lcod.forge.version.UpdateType;

/**
 * Pending changes of a package since its latest release.
 *
 * @param type kind of update, empty for a forced update that only changes pre-release or build data
 * @param version version the package would have if released now
 * @param changelog qualifying commits, newest first
 */
public record Update(Optional<UpdateType> type, String version, List<ConventionalCommit> changelog) {
    public Update {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(version, "version");
        changelog = List.copyOf(Objects.requireNonNull(changelog, "changelog"));
    }
}
