package work.lcod.forge.git;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a single git invocation. Implementations do not interpret the exit code.
 */
@FunctionalInterface
public interface GitCommandRunner {
    CommandResult run(Path workingDirectory, List<String> arguments);

    record CommandResult(String command, List<String> arguments, int exitCode, String stdout, String stderr) {
        public CommandResult {
            arguments = List.copyOf(arguments);
            stdout = stdout == null ? "" : stdout;
            stderr = stderr == null ? "" : stderr;
        }

        public boolean succeeded() {
            return exitCode == 0;
        }
    }
}
