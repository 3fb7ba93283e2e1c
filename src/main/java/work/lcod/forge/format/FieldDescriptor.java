package work.lcod.forge.format;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of one field in a formatted record.
 *
 * <p>A field is either skipped (it consumes no slot in the output), a text leaf rendered from a
 * format placeholder, or a group of named child fields.</p>
 */
public sealed interface FieldDescriptor permits FieldDescriptor.Skip, FieldDescriptor.Text, FieldDescriptor.Group {
    boolean optional();

    /**
     * Placeholders of every non-skipped leaf, depth-first in declaration order.
     */
    List<String> placeholders();

    static Skip skip() {
        return Skip.INSTANCE;
    }

    static Text text(String placeholder) {
        return new Text(placeholder, false, FieldTransform.IDENTITY);
    }

    static Text text(String placeholder, FieldTransform transform) {
        return new Text(placeholder, false, transform);
    }

    static Text optionalText(String placeholder) {
        return new Text(placeholder, true, FieldTransform.IDENTITY);
    }

    static Text optionalText(String placeholder, FieldTransform transform) {
        return new Text(placeholder, true, transform);
    }

    static GroupBuilder group() {
        return new GroupBuilder();
    }

    record Skip() implements FieldDescriptor {
        static final Skip INSTANCE = new Skip();

        @Override
        public boolean optional() {
            return true;
        }

        @Override
        public List<String> placeholders() {
            return List.of();
        }
    }

    record Text(String placeholder, boolean optional, FieldTransform transform) implements FieldDescriptor {
        public Text {
            Objects.requireNonNull(placeholder, "placeholder");
            Objects.requireNonNull(transform, "transform");
        }

        @Override
        public List<String> placeholders() {
            return List.of(placeholder);
        }
    }

    record Group(Map<String, FieldDescriptor> fields, boolean optional) implements FieldDescriptor {
        public Group {
            Objects.requireNonNull(fields, "fields");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @Override
        public List<String> placeholders() {
            List<String> result = new ArrayList<>();
            for (FieldDescriptor field : fields.values()) {
                result.addAll(field.placeholders());
            }
            return result;
        }
    }

    final class GroupBuilder {
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private boolean optional;

        private GroupBuilder() {}

        public GroupBuilder field(String name, FieldDescriptor descriptor) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(descriptor, "descriptor");
            if (fields.putIfAbsent(name, descriptor) != null) {
                throw new IllegalArgumentException("Duplicate field: " + name);
            }
            return this;
        }

        public GroupBuilder optional() {
            this.optional = true;
            return this;
        }

        public Group build() {
            return new Group(fields, optional);
        }
    }
}
