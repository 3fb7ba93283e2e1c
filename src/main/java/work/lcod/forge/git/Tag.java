package work.lcod.forge.git;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A tag and the commit it (possibly through other tags) points to. Lightweight tags have no
 * tagger, subject or body.
 */
public record Tag(
    String name,
    Commit commit,
    Optional<User> tagger,
    Optional<String> subject,
    Optional<String> body,
    Map<String, String> trailers
) {
    public Tag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(commit, "commit");
        Objects.requireNonNull(tagger, "tagger");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(body, "body");
        trailers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(trailers, "trailers")));
    }

    public static Tag lightweight(String name, Commit commit) {
        return new Tag(name, commit, Optional.empty(), Optional.empty(), Optional.empty(), Map.of());
    }
}
