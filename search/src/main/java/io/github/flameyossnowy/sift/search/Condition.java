package io.github.flameyossnowy.sift.search;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Compiled description of one filter field: where its value lives, which columns it
 * constrains, and how.
 * <p>
 * Built once per filter class and never modified afterwards.
 */
public record Condition(
    FieldPath fieldPath,
    List<String> columns,
    Operator operator,
    @Nullable String alias,
    Map<String, String> params
) {
    public static final String PARAM_DELIMITER = "delimiter";
    public static final String PARAM_TYPE = "type";

    public Condition {
        columns = List.copyOf(columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Condition for '" + fieldPath + "' needs at least one column");
        }
        params = Map.copyOf(params);
    }

    public @NotNull String column() {
        return columns.get(0);
    }

    public @Nullable String param(String key) {
        return params.get(key);
    }

    public String param(String key, String fallback) {
        String value = params.get(key);
        return value == null || value.isEmpty() ? fallback : value;
    }
}
