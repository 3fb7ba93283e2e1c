package work.lcod.forge.format;

import java.util.List;
import java.util.Objects;

/**
 * A record layout: the delimiter placeholder wrapping every record plus the root group of fields.
 *
 * <p>The delimiter must expand to text that no field can emit; an object hash works because no
 * field other than the hash itself can be equal to it.</p>
 */
public record FormatDescriptor(String delimiter, FieldDescriptor.Group root) {
    public FormatDescriptor {
        Objects.requireNonNull(delimiter, "delimiter");
        Objects.requireNonNull(root, "root");
        if (delimiter.isEmpty() || delimiter.contains("!")) {
            throw new IllegalArgumentException("Delimiter must be non-empty and must not contain '!'");
        }
        if (root.placeholders().isEmpty()) {
            throw new IllegalArgumentException("Format must declare at least one field");
        }
    }

    public List<String> placeholders() {
        return root.placeholders();
    }

    /**
     * Format string for the tool: {@code <delimiter>!<field1><delimiter>...<fieldN><delimiter>}.
     */
    public String formatArgument() {
        return delimiter + "!" + String.join(delimiter, placeholders()) + delimiter;
    }
}
