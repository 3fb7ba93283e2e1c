package work.lcod.forge.format;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes records produced by a {@link FormatDescriptor#formatArgument()} format string.
 *
 * <p>Each record is decoded into a {@code Map<String, Object>} mirroring the descriptor tree: text
 * leaves become their (transformed) values, groups become nested maps, absent fields are omitted.</p>
 */
public final class FormatDecoder {
    /** Value emitted by the tool for an optional field that has no value. */
    public static final String ABSENT = "\u0000";

    private FormatDecoder() {}

    public static List<Map<String, Object>> decode(FormatDescriptor descriptor, String output) {
        List<Map<String, Object>> records = new ArrayList<>();
        if (output == null) {
            return records;
        }
        int expected = descriptor.placeholders().size();
        int cursor = skipWhitespace(output, 0);
        while (cursor < output.length()) {
            int bang = output.indexOf('!', cursor);
            if (bang <= cursor) {
                throw new DecodeException("Missing record delimiter", cursor);
            }
            String delimiter = output.substring(cursor, bang);
            if (delimiter.chars().anyMatch(Character::isWhitespace)) {
                throw new DecodeException("Unexpected content between records", cursor);
            }
            Deque<String> parts = new ArrayDeque<>(expected);
            int position = bang + 1;
            for (int i = 0; i < expected; i++) {
                int end = output.indexOf(delimiter, position);
                if (end < 0) {
                    throw new DecodeException("Expected " + expected + " fields but found " + i, position);
                }
                parts.add(output.substring(position, end));
                position = end + delimiter.length();
            }
            Map<String, Object> record = decodeGroup(descriptor.root(), parts, cursor);
            if (record == null) {
                throw new DecodeException("Record has no values", cursor);
            }
            records.add(record);
            cursor = skipWhitespace(output, position);
        }
        return records;
    }

    private static Map<String, Object> decodeGroup(FieldDescriptor.Group group, Deque<String> parts, int offset) {
        Map<String, Object> values = new LinkedHashMap<>();
        Map<String, String> raw = new LinkedHashMap<>();
        for (var entry : group.fields().entrySet()) {
            String name = entry.getKey();
            FieldDescriptor field = entry.getValue();
            if (field instanceof FieldDescriptor.Text text) {
                String part = parts.poll();
                if (part == null) {
                    throw new DecodeException("Missing value for field '" + name + "'", offset);
                }
                Object value = decodeText(text, part, Collections.unmodifiableMap(new LinkedHashMap<>(raw)));
                raw.put(name, part);
                if (value != null) {
                    values.put(name, value);
                }
            } else if (field instanceof FieldDescriptor.Group child) {
                Map<String, Object> value = decodeGroup(child, parts, offset);
                if (value != null) {
                    values.put(name, value);
                }
            }
        }
        if (group.optional() && values.values().stream().allMatch(FormatDecoder::isEmptyGroup)) {
            return null;
        }
        return values;
    }

    private static boolean isEmptyGroup(Object value) {
        return value instanceof Map<?, ?> map && map.isEmpty();
    }

    private static Object decodeText(FieldDescriptor.Text text, String part, Map<String, String> siblings) {
        if (text.optional() && ABSENT.equals(part)) {
            return null;
        }
        return text.transform().apply(part, siblings);
    }

    private static int skipWhitespace(String value, int from) {
        int index = from;
        while (index < value.length() && Character.isWhitespace(value.charAt(index))) {
            index++;
        }
        return index;
    }
}
