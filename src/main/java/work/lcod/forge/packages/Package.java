package work.lcod.forge.packages;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A resolved package.
 *
 * @param directory absolute package directory
 * @param module module name, used as release tag prefix and commit scope
 */
public record Package(Path directory, String module, PackageConfig config, VersionState state) {
    public Package {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(state, "state");
    }

    public Optional<Release> release() {
        return state.release();
    }

    public Optional<Update> update() {
        return state.update();
    }

    /**
     * Effective version: the pending update, else the release, else the declared version.
     */
    public Optional<String> version() {
        return update().map(Update::version)
            .or(() -> release().map(Release::version))
            .or(config::version);
    }
}
