package work.lcod.forge.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.forge.api.ForgeRunner;
import work.lcod.forge.api.LogLevel;
import work.lcod.forge.api.ResolveConfiguration;
import work.lcod.forge.api.ResolveReport;
import work.lcod.forge.shared.DurationParser;

@CommandLine.Command(
    name = "lcod-forge",
    description = "Resolve package versions from release tags and Conventional Commits.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ForgeCommand implements Callable<Integer> {
    private final ForgeRunner runner;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        paramLabel = "DIR",
        description = "Package or workspace directories (default: current directory).",
        arity = "0..*"
    )
    private List<Path> directories = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--filter"},
        paramLabel = "GLOB",
        description = "Only keep packages whose module or relative directory matches (repeatable)."
    )
    private List<String> filters = new ArrayList<>();

    @CommandLine.Option(
        names = "--concurrency",
        description = "Packages resolved in parallel (default: available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer concurrency;

    @CommandLine.Option(
        names = "--git",
        description = "Git executable.",
        defaultValue = "git"
    )
    private String gitExecutable;

    @CommandLine.Option(
        names = "--timeout",
        description = "Timeout applied to each git command (e.g. 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal), FORGE_LOG_LEVEL when unset.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--version-only",
        description = "Print one '<module> <version>' line per package instead of the JSON report."
    )
    private boolean versionOnly;

    ForgeCommand() {
        this(new ForgeRunner());
    }

    ForgeCommand(ForgeRunner runner) {
        this.runner = runner;
    }

    @Override
    public Integer call() {
        if (concurrency != null && concurrency < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--concurrency must be at least 1");
        }
        ResolveConfiguration.Builder builder = ResolveConfiguration.builder()
            .directories(directories.isEmpty() ? List.of(Path.of(".")) : directories)
            .filters(filters)
            .gitExecutable(gitExecutable)
            .timeout(parseTimeout())
            .logLevel(resolveLogLevel());
        if (concurrency != null) {
            builder.concurrency(concurrency);
        }

        ResolveReport report = runner.run(builder.build());
        PrintWriter out = spec.commandLine().getOut();
        if (versionOnly) {
            report.versionLines().forEach(out::println);
        } else {
            out.println(report.toPrettyJson());
        }
        out.flush();
        return report.status().exitCode();
    }

    private Optional<Duration> parseTimeout() {
        try {
            return DurationParser.parse(timeoutRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("FORGE_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
