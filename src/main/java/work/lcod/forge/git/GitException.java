package work.lcod.forge.git;

import java.util.List;

/**
 * Failure while running or interpreting a git command.
 *
 * <p>When the failure comes from a git process, the exception carries the attempted command, its
 * arguments, the exit code and the captured output.</p>
 */
public class GitException extends RuntimeException {
    private final String command;
    private final List<String> arguments;
    private final int exitCode;
    private final String output;

    public GitException(String message) {
        this(message, null, List.of(), -1, "", null);
    }

    public GitException(String message, Throwable cause) {
        this(message, null, List.of(), -1, "", cause);
    }

    public GitException(String message, String command, List<String> arguments, int exitCode, String output) {
        this(message, command, arguments, exitCode, output, null);
    }

    public GitException(
        String message,
        String command,
        List<String> arguments,
        int exitCode,
        String output,
        Throwable cause
    ) {
        super(message, cause);
        this.command = command;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    /** Executable that was run, or {@code null} when the failure did not come from a process. */
    public String command() {
        return command;
    }

    public List<String> arguments() {
        return arguments;
    }

    /** Process exit code, {@code -1} when no process exited. */
    public int exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
