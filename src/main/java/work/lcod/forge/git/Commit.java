package work.lcod.forge.git;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single commit in a git repository. The full hash is its identity.
 *
 * @param hash full object hash
 * @param shortHash abbreviated hash, as printed by git
 * @param parent first parent, absent for root commits
 * @param summary first line of the commit message
 * @param body message without the summary line and without the trailer block
 * @param trailers {@code key: value} lines of the trailer block at the end of the message, in order
 */
public record Commit(
    String hash,
    String shortHash,
    Optional<Parent> parent,
    User author,
    User committer,
    String summary,
    Optional<String> body,
    Map<String, String> trailers
) {
    public Commit {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(shortHash, "shortHash");
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(author, "author");
        Objects.requireNonNull(committer, "committer");
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(body, "body");
        trailers = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(trailers, "trailers")));
    }

    public record Parent(String hash, String shortHash) {
        public Parent {
            Objects.requireNonNull(hash, "hash");
            Objects.requireNonNull(shortHash, "shortHash");
        }
    }
}
