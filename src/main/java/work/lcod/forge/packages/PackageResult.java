package work.lcod.forge.packages;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of resolving one package of a workspace.
 */
public sealed interface PackageResult permits PackageResult.Resolved, PackageResult.Failed {
    Path directory();

    record Resolved(Package pkg) implements PackageResult {
        public Resolved {
            Objects.requireNonNull(pkg, "pkg");
        }

        @Override
        public Path directory() {
            return pkg.directory();
        }
    }

    /**
     * @param error typed failure: {@link PackageException}, {@link work.lcod.forge.version.VersionException},
     *     {@link work.lcod.forge.git.GitException} or {@link work.lcod.forge.format.DecodeException}
     */
    record Failed(Path directory, RuntimeException error) implements PackageResult {
        public Failed {
            Objects.requireNonNull(directory, "directory");
            Objects.requireNonNull(error, "error");
        }
    }
}
