package work.lcod.forge.git;

import java.util.Optional;

/**
 * Filters for {@link GitRepository#listTags(TagListOptions)}. Revision values are any commit-ish
 * accepted by git (hash, ref name, {@code HEAD}).
 */
public record TagListOptions(
    Optional<String> name,
    boolean sortByVersion,
    Optional<String> contains,
    Optional<String> noContains,
    Optional<String> merged,
    Optional<String> noMerged,
    Optional<String> pointsAt
) {
    public static TagListOptions all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private boolean sortByVersion;
        private String contains;
        private String noContains;
        private String merged;
        private String noMerged;
        private String pointsAt;

        /** Tag name pattern, e.g. {@code module@*}. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Highest version first. */
        public Builder sortByVersion(boolean sortByVersion) {
            this.sortByVersion = sortByVersion;
            return this;
        }

        public Builder contains(String commit) {
            this.contains = commit;
            return this;
        }

        public Builder noContains(String commit) {
            this.noContains = commit;
            return this;
        }

        public Builder merged(String commit) {
            this.merged = commit;
            return this;
        }

        public Builder noMerged(String commit) {
            this.noMerged = commit;
            return this;
        }

        public Builder pointsAt(String commit) {
            this.pointsAt = commit;
            return this;
        }

        public TagListOptions build() {
            return new TagListOptions(
                Optional.ofNullable(name),
                sortByVersion,
                Optional.ofNullable(contains),
                Optional.ofNullable(noContains),
                Optional.ofNullable(merged),
                Optional.ofNullable(noMerged),
                Optional.ofNullable(pointsAt)
            );
        }
    }
}
