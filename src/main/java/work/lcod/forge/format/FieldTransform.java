package work.lcod.forge.format;

import java.util.Map;

/**
 * Converts the raw text of a leaf field into its decoded value.
 */
@FunctionalInterface
public interface FieldTransform {
    FieldTransform IDENTITY = (value, siblings) -> value;

    /**
     * @param value raw text emitted for the field
     * @param siblings raw text of the leaf fields already decoded in the same group, in declaration order
     * @return the decoded value, or {@code null} when the field should be treated as absent
     */
    Object apply(String value, Map<String, String> siblings);
}
