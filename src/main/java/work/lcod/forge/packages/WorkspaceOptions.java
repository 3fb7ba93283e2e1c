package work.lcod.forge.packages;

import java.util.List;
import java.util.Objects;

/**
 * @param filters glob patterns matched against the module name or the package directory relative
 *     to its root, empty to keep every package
 * @param concurrency number of packages resolved in parallel
 */
public record WorkspaceOptions(List<String> filters, int concurrency) {
    public WorkspaceOptions {
        filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
        }
    }

    public static WorkspaceOptions defaults() {
        return new WorkspaceOptions(List.of(), Runtime.getRuntime().availableProcessors());
    }
}
