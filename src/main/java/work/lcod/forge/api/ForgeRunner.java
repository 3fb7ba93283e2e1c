package work.lcod.forge.api;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import work.lcod.forge.git.GitCli;
import work.lcod.forge.git.GitCommandRunner;
import work.lcod.forge.git.GitRepository;
import work.lcod.forge.git.ProcessGitCommandRunner;
import work.lcod.forge.packages.ManifestLoader;
import work.lcod.forge.packages.PackageResolver;
import work.lcod.forge.packages.PackageResult;
import work.lcod.forge.packages.Workspace;
import work.lcod.forge.packages.WorkspaceOptions;

/**
 * Public entry point for embedding the version resolution.
 */
public final class ForgeRunner {
    private final Function<ResolveConfiguration, GitCommandRunner> runners;
    private final PrintStream diagnostics;

    public ForgeRunner() {
        this(ForgeRunner::processRunner, System.err);
    }

    /**
     * @param runners creates the git command runner used for a run
     * @param diagnostics receives diagnostics allowed by the configured log level
     */
    public ForgeRunner(Function<ResolveConfiguration, GitCommandRunner> runners, PrintStream diagnostics) {
        this.runners = Objects.requireNonNull(runners, "runners");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public ResolveReport run(ResolveConfiguration configuration) {
        var started = Instant.now();
        try {
            GitCommandRunner runner = runners.apply(configuration);
            Function<Path, GitRepository> repositories = directory -> new GitCli(directory, runner);
            ManifestLoader manifests = new ManifestLoader();
            Workspace workspace = new Workspace(manifests, new PackageResolver(manifests, repositories));
            List<PackageResult> results = workspace.resolve(
                configuration.directories(),
                new WorkspaceOptions(configuration.filters(), configuration.concurrency())
            );
            for (PackageResult result : results) {
                log(configuration.logLevel(), result);
            }
            return ResolveReport.of(results, started);
        } catch (RuntimeException ex) {
            if (configuration.logLevel().enables(LogLevel.FATAL)) {
                diagnostics.printf("Cannot resolve packages: %s%n", ex.getMessage());
            }
            if (Boolean.getBoolean("forge.debug")) {
                ex.printStackTrace(diagnostics);
            }
            return ResolveReport.failure(ex.getMessage(), started);
        }
    }

    private void log(LogLevel level, PackageResult result) {
        if (result instanceof PackageResult.Failed failed) {
            if (level.enables(LogLevel.ERROR)) {
                diagnostics.printf("Cannot resolve package %s: %s%n", failed.directory(), failed.error().getMessage());
            }
            if (Boolean.getBoolean("forge.debug")) {
                failed.error().printStackTrace(diagnostics);
            }
        } else if (result instanceof PackageResult.Resolved resolved && level.enables(LogLevel.INFO)) {
            var pkg = resolved.pkg();
            diagnostics.printf(
                "Resolved %s (%s): %s%n",
                pkg.module(),
                pkg.state().getClass().getSimpleName(),
                pkg.version().orElse("unversioned")
            );
        }
    }

    private static GitCommandRunner processRunner(ResolveConfiguration configuration) {
        Optional<Duration> timeout = configuration.timeout().filter(duration -> !duration.isZero());
        PrintStream trace = configuration.logLevel().enables(LogLevel.DEBUG) ? System.err : null;
        return new ProcessGitCommandRunner(configuration.gitExecutable(), timeout, trace);
    }
}
