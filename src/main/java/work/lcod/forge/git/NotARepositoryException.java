package work.lcod.forge.git;

import java.util.List;

/**
 * Raised when git is run outside of any repository. Callers may treat this as "no release
 * information" instead of a failure.
 */
public final class NotARepositoryException extends GitException {
    public NotARepositoryException(String message, String command, List<String> arguments, int exitCode, String output) {
        super(message, command, arguments, exitCode, output);
    }
}
