package work.lcod.forge.git;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Filters for {@link GitRepository#log(CommitLogOptions)}.
 *
 * @param from exclusive start of the range; commits reachable from it are left out
 * @param to inclusive end of the range, {@code HEAD} when only {@code from} is set
 * @param paths only commits touching these paths, relative to the repository working directory
 */
public record CommitLogOptions(
    Optional<String> from,
    Optional<String> to,
    List<String> paths,
    OptionalInt maxCount,
    OptionalInt skip
) {
    public CommitLogOptions {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        paths = List.copyOf(paths);
        Objects.requireNonNull(maxCount, "maxCount");
        Objects.requireNonNull(skip, "skip");
    }

    public static CommitLogOptions all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Revision argument for {@code git log}, or empty for the default ({@code HEAD}).
     */
    Optional<String> range() {
        if (from.isEmpty()) {
            return to;
        }
        return Optional.of(from.get() + ".." + to.orElse("HEAD"));
    }

    public static final class Builder {
        private String from;
        private String to;
        private List<String> paths = List.of();
        private OptionalInt maxCount = OptionalInt.empty();
        private OptionalInt skip = OptionalInt.empty();

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder paths(List<String> paths) {
            this.paths = paths;
            return this;
        }

        public Builder maxCount(int maxCount) {
            this.maxCount = OptionalInt.of(maxCount);
            return this;
        }

        public Builder skip(int skip) {
            this.skip = OptionalInt.of(skip);
            return this;
        }

        public CommitLogOptions build() {
            return new CommitLogOptions(Optional.ofNullable(from), Optional.ofNullable(to), paths, maxCount, skip);
        }
    }
}
