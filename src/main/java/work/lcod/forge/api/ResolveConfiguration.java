package work.lcod.forge.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@link ForgeRunner} run.
 *
 * @param directories package or workspace root directories
 * @param filters glob patterns selecting packages by module name or relative directory
 * @param concurrency number of packages resolved in parallel
 * @param gitExecutable git executable name or path
 * @param timeout bound applied to every git process
 */
public record ResolveConfiguration(
    List<Path> directories,
    List<String> filters,
    int concurrency,
    String gitExecutable,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public ResolveConfiguration {
        directories = List.copyOf(Objects.requireNonNull(directories, "directories"));
        filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
        Objects.requireNonNull(gitExecutable, "gitExecutable");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        if (directories.isEmpty()) {
            throw new IllegalArgumentException("At least one directory is required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<Path> directories = new ArrayList<>();
        private final List<String> filters = new ArrayList<>();
        private int concurrency = Runtime.getRuntime().availableProcessors();
        private String gitExecutable = "git";
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder directory(Path directory) {
            this.directories.add(directory);
            return this;
        }

        public Builder directories(List<Path> directories) {
            this.directories.addAll(directories);
            return this;
        }

        public Builder filters(List<String> filters) {
            this.filters.addAll(filters);
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder gitExecutable(String gitExecutable) {
            this.gitExecutable = gitExecutable;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ResolveConfiguration build() {
            return new ResolveConfiguration(directories, filters, concurrency, gitExecutable, timeout, logLevel);
        }
    }
}
