package work.lcod.forge.version;

/**
 * Semantic contract violation while computing versions: a malformed version string, a missing
 * declared version or a forced downgrade.
 */
public final class VersionException extends RuntimeException {
    public VersionException(String message) {
        super(message);
    }

    public VersionException(String message, Throwable cause) {
        super(message, cause);
    }
}
