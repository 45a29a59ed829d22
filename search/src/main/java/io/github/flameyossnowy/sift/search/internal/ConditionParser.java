package io.github.flameyossnowy.sift.search.internal;

import io.github.flameyossnowy.sift.api.annotations.Search;
import io.github.flameyossnowy.sift.search.Condition;
import io.github.flameyossnowy.sift.search.FieldPath;
import io.github.flameyossnowy.sift.search.Operator;
import io.github.flameyossnowy.sift.search.OperatorFamily;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a filter class and turns its {@code @Search} annotated fields into {@link Condition}s.
 * <p>
 * Fields are visited in declaration order (component order for records). Inherited fields
 * are visited before the class's own, and nested filter types are only entered when the
 * field is marked {@code @Search("dive")}. Definition problems are logged and the offending
 * field is skipped; the walk itself never throws.
 */
public final class ConditionParser {
    private final Logger logger;

    public ConditionParser(@NotNull Logger logger) {
        this.logger = logger;
    }

    public @NotNull List<Condition> parse(@NotNull Class<?> type) {
        if (!FilterShapes.isFilterShape(type)) {
            logger.warn("Type {} is not a filter class; no search conditions compiled", type.getName());
            return List.of();
        }

        List<Condition> conditions = new ArrayList<>();
        visit(type, FieldPath.ROOT, new HashSet<>(), conditions);
        return List.copyOf(conditions);
    }

    private void visit(Class<?> type, FieldPath parent, Set<Class<?>> onPath, List<Condition> out) {
        if (!onPath.add(type)) {
            logger.warn("Skipping '{}': {} is already being visited on this path", parent, type.getName());
            return;
        }

        Class<?> superclass = type.getSuperclass();
        if (superclass != null && FilterShapes.isFilterShape(superclass) && !isIgnored(superclass)) {
            visit(superclass, parent, onPath, out);
        }

        List<Field> fields = declaredFields(type);
        for (int index = 0; index < fields.size(); index++) {
            Field field = fields.get(index);
            FieldPath path = parent.append(field, index);

            Search search = field.getAnnotation(Search.class);
            String raw = search == null ? "" : search.value().trim();
            if (Search.IGNORE.equals(raw)) {
                continue;
            }

            if (!field.trySetAccessible()) {
                logger.warn("Skipping '{}': field is not accessible", path);
                continue;
            }

            if (Search.DIVE.equals(raw)) {
                if (!FilterShapes.isFilterShape(field.getType())) {
                    logger.warn("Skipping '{}': cannot dive into non-filter type {}", path, field.getType().getName());
                    continue;
                }
                visit(field.getType(), path, onPath, out);
                continue;
            }

            toCondition(path, SearchTag.parse(raw, path.name(), logger)).ifPresent(out::add);
        }

        onPath.remove(type);
    }

    private Optional<Condition> toCondition(FieldPath path, SearchTag tag) {
        String token = tag.operatorToken();
        Optional<Operator> operator = Operator.fromToken(token);
        if (operator.isEmpty()) {
            logger.warn("Skipping '{}': unknown search operator '{}'", path, token);
            return Optional.empty();
        }

        List<String> columns = columns(path, tag);
        if (columns.size() > 1 && operator.get().family() != OperatorFamily.PATTERN) {
            logger.warn("Field '{}' lists {} columns but '{}' only supports one; using '{}'",
                path, columns.size(), token, columns.get(0));
            columns = List.of(columns.get(0));
        }

        return Optional.of(new Condition(path, columns, operator.get(), tag.alias(), tag.params()));
    }

    private static List<String> columns(FieldPath path, SearchTag tag) {
        List<String> columns = new ArrayList<>(1);
        if (tag.column() != null) {
            for (String column : tag.column().split("\\|")) {
                String trimmed = column.trim();
                if (!trimmed.isEmpty()) {
                    columns.add(trimmed);
                }
            }
        }
        if (columns.isEmpty()) {
            columns.add(ColumnNames.snakeCase(path.leaf().getName()));
        }
        return columns;
    }

    private static boolean isIgnored(Class<?> type) {
        Search search = type.getAnnotation(Search.class);
        return search != null && Search.IGNORE.equals(search.value().trim());
    }

    private List<Field> declaredFields(Class<?> type) {
        List<Field> fields = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                try {
                    fields.add(type.getDeclaredField(component.getName()));
                } catch (NoSuchFieldException e) {
                    logger.warn("Record {} has no backing field for component '{}'", type.getName(), component.getName(), e);
                }
            }
            return fields;
        }

        for (Field field : type.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                fields.add(field);
            }
        }
        return fields;
    }
}
