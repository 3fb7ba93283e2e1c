package work.lcod.forge.git;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@link GitCommandRunner} backed by a real {@code git} process.
 */
public final class ProcessGitCommandRunner implements GitCommandRunner {
    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "lcod-forge-git-output");
        thread.setDaemon(true);
        return thread;
    });

    private final String executable;
    private final Optional<Duration> timeout;
    private final PrintStream trace;

    public ProcessGitCommandRunner() {
        this("git", Optional.empty(), null);
    }

    /**
     * @param executable git executable name or path
     * @param timeout bound applied to every process, empty for none
     * @param trace stream receiving each command line before it runs, or {@code null}
     */
    public ProcessGitCommandRunner(String executable, Optional<Duration> timeout, PrintStream trace) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.trace = trace;
    }

    @Override
    public CommandResult run(Path workingDirectory, List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(arguments);
        if (trace != null) {
            trace.println("+ " + String.join(" ", command));
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        builder.environment().put("GIT_EDITOR", "true");
        builder.environment().put("LC_ALL", "C");
        builder.redirectInput(ProcessBuilder.Redirect.PIPE);

        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new GitException("Cannot run " + executable + ": " + ex.getMessage(), executable, arguments, -1, "", ex);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException ex) {
            process.destroyForcibly();
            throw new GitException("Cannot close stdin of " + executable, executable, arguments, -1, "", ex);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> read(process.getInputStream()), STREAM_READERS);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> read(process.getErrorStream()), STREAM_READERS);
        try {
            if (timeout.isPresent()) {
                if (!process.waitFor(timeout.get().toMillis(), TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                    throw new GitException(
                        "git " + firstArgument(arguments) + " timed out after " + timeout.get(),
                        executable,
                        arguments,
                        -1,
                        ""
                    );
                }
            } else {
                process.waitFor();
            }
            return new CommandResult(executable, arguments, process.exitValue(), stdout.join(), stderr.join());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new GitException("Interrupted while running git " + firstArgument(arguments), executable, arguments, -1, "", ex);
        }
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static String firstArgument(List<String> arguments) {
        return arguments.stream()
            .filter(argument -> !argument.startsWith("-"))
            .findFirst()
            .orElse("");
    }
}
