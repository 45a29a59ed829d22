package io.github.flameyossnowy.sift.search.internal;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed form of a {@code @Search} annotation value.
 * <p>
 * The value is a comma-separated list of {@code key=value} pairs. A single bare token
 * is the operator shorthand; {@code params} holds space-separated {@code key:value}
 * entries split at the first colon.
 *
 * @param operator  explicit {@code operator=} token, or {@code null}
 * @param shorthand the bare token, or {@code null}
 * @param fallback  the {@code default=} token, or {@code null}
 * @param column    raw {@code column=} value, pipe-separated, or {@code null}
 * @param alias     {@code alias=} value, or {@code null}
 * @param params    parsed {@code params=} entries
 */
public record SearchTag(
    @Nullable String operator,
    @Nullable String shorthand,
    @Nullable String fallback,
    @Nullable String column,
    @Nullable String alias,
    Map<String, String> params
) {
    public static final String KEY_OPERATOR = "operator";
    public static final String KEY_DEFAULT = "default";
    public static final String KEY_COLUMN = "column";
    public static final String KEY_ALIAS = "alias";
    public static final String KEY_PARAMS = "params";

    public static final String DEFAULT_OPERATOR = "eq";

    public static final SearchTag EMPTY = new SearchTag(null, null, null, null, null, Map.of());

    public SearchTag {
        params = Map.copyOf(params);
    }

    /**
     * Operator token to use: {@code operator=} first, then the shorthand, then
     * {@code default=}, then {@code eq}.
     */
    public @NotNull String operatorToken() {
        if (operator != null) return operator;
        if (shorthand != null) return shorthand;
        if (fallback != null) return fallback;
        return DEFAULT_OPERATOR;
    }

    public static @NotNull SearchTag parse(@NotNull String raw, @NotNull String owner, @NotNull Logger logger) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return EMPTY;
        }

        String operator = null;
        String shorthand = null;
        String fallback = null;
        String column = null;
        String alias = null;
        Map<String, String> params = Map.of();

        for (String part : trimmed.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                continue;
            }

            int eq = entry.indexOf('=');
            if (eq < 0) {
                if (shorthand != null) {
                    logger.warn("Field '{}' declares more than one bare operator ('{}', '{}'); keeping '{}'",
                        owner, shorthand, entry, shorthand);
                } else {
                    shorthand = entry;
                }
                continue;
            }

            String key = entry.substring(0, eq).trim();
            String value = blankToNull(entry.substring(eq + 1).trim());
            switch (key) {
                case KEY_OPERATOR -> operator = value;
                case KEY_DEFAULT -> fallback = value;
                case KEY_COLUMN -> column = value;
                case KEY_ALIAS -> alias = value;
                case KEY_PARAMS -> params = parseParams(value, owner, logger);
                default -> logger.warn("Field '{}' has unknown search attribute '{}'", owner, key);
            }
        }

        return new SearchTag(operator, shorthand, fallback, column, alias, params);
    }

    static @NotNull Map<String, String> parseParams(@Nullable String raw, String owner, Logger logger) {
        if (raw == null) {
            return Map.of();
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (String token : raw.trim().split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            int colon = token.indexOf(':');
            if (colon <= 0) {
                logger.warn("Field '{}' has malformed search param '{}', expected key:value", owner, token);
                continue;
            }
            params.put(token.substring(0, colon), token.substring(colon + 1));
        }
        return params;
    }

    private static @Nullable String blankToNull(String value) {
        return value.isEmpty() ? null : value;
    }
}
