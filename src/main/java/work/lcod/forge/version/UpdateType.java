package work.lcod.forge.version;

import java.util.Locale;

/**
 * Semantic version component bumped by an update.
 */
public enum UpdateType {
    MAJOR,
    MINOR,
    PATCH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
