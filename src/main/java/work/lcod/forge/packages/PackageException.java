package work.lcod.forge.packages;

/**
 * Raised when a package manifest is missing or malformed.
 */
public class PackageException extends RuntimeException {
    public PackageException(String message) {
        super(message);
    }

    public PackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
