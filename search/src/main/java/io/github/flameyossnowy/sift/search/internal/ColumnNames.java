package io.github.flameyossnowy.sift.search.internal;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

public final class ColumnNames {
    private ColumnNames() {
    }

    /**
     * Converts a Java field name to snake_case.
     * <p>
     * Word boundaries fall between a lower-case letter or digit and an upper-case letter,
     * between letters and digits, and before the last capital of an acronym
     * ({@code HTTPServer -> http_server}, {@code name1 -> name_1}).
     */
    public static @NotNull String snakeCase(@NotNull String name) {
        int length = name.length();
        StringBuilder out = new StringBuilder(length + 4);
        for (int i = 0; i < length; i++) {
            char c = name.charAt(i);
            if (c == '_' || c == '-' || Character.isWhitespace(c)) {
                if (out.length() > 0 && out.charAt(out.length() - 1) != '_') {
                    out.append('_');
                }
                continue;
            }

            if (i > 0 && out.length() > 0 && out.charAt(out.length() - 1) != '_'
                && isBoundary(name.charAt(i - 1), c, i + 1 < length ? name.charAt(i + 1) : 0)) {
                out.append('_');
            }
            out.append(Character.toLowerCase(c));
        }

        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '_') {
            end--;
        }
        out.setLength(end);
        return out.toString();
    }

    private static boolean isBoundary(char previous, char current, char next) {
        if (Character.isUpperCase(current)) {
            if (Character.isLowerCase(previous) || Character.isDigit(previous)) {
                return true;
            }
            return Character.isUpperCase(previous) && Character.isLowerCase(next);
        }
        if (Character.isDigit(current)) {
            return Character.isLetter(previous);
        }
        return Character.isLetter(current) && Character.isDigit(previous);
    }

    /**
     * Prefixes the column with {@code alias.} when an alias is present.
     */
    public static @NotNull String qualify(@Nullable String alias, @NotNull String column) {
        if (alias == null || alias.isEmpty()) {
            return column;
        }
        return alias + '.' + column;
    }
}
