package io.github.flameyossnowy.sift.search;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Locates a leaf field inside a (possibly nested) filter object.
 * <p>
 * {@code fields} is the chain of reflective fields from the filter root to the leaf;
 * {@code indices} holds the declared position of each hop within its own class.
 * Inherited fields are reached through the same object, so they add a hop without
 * adding a level of nesting.
 */
public record FieldPath(List<Field> fields, List<Integer> indices) {
    public static final FieldPath ROOT = new FieldPath(List.of(), List.of());

    public FieldPath {
        fields = List.copyOf(fields);
        indices = List.copyOf(indices);
    }

    @Contract("_, _ -> new")
    public @NotNull FieldPath append(@NotNull Field field, int index) {
        List<Field> nextFields = new ArrayList<>(fields.size() + 1);
        nextFields.addAll(fields);
        nextFields.add(field);

        List<Integer> nextIndices = new ArrayList<>(indices.size() + 1);
        nextIndices.addAll(indices);
        nextIndices.add(index);
        return new FieldPath(nextFields, nextIndices);
    }

    public Field leaf() {
        return fields.get(fields.size() - 1);
    }

    /**
     * Dotted field names, e.g. {@code user.name}.
     */
    public String name() {
        StringJoiner joiner = new StringJoiner(".");
        for (Field field : fields) {
            joiner.add(field.getName());
        }
        return joiner.toString();
    }

    @Override
    public String toString() {
        return name();
    }
}
