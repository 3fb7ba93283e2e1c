package work.lcod.forge.packages;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Package settings read from its manifest.
 *
 * @param name package name, possibly scoped ({@code @scope/module})
 * @param version declared version, not necessarily a valid semantic version
 * @param workspace child package directories, relative to the package directory
 */
public record PackageConfig(Optional<String> name, Optional<String> version, List<String> workspace) {
    public PackageConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        workspace = List.copyOf(Objects.requireNonNull(workspace, "workspace"));
    }

    public boolean isWorkspace() {
        return !workspace.isEmpty();
    }

    /**
     * Last segment of the package name, {@code module} for {@code @scope/module}.
     */
    public Optional<String> module() {
        return name
            .map(value -> value.substring(value.lastIndexOf('/') + 1))
            .filter(value -> !value.isBlank());
    }
}
