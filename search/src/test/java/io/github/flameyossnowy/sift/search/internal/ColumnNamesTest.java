package io.github.flameyossnowy.sift.search.internal;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColumnNamesTest {

    @Test
    void camel_case_to_snake_case() {
        assertEquals("min_price", ColumnNames.snakeCase("minPrice"));
        assertEquals("min_price", ColumnNames.snakeCase("MinPrice"));
        assertEquals("salary", ColumnNames.snakeCase("salary"));
        assertEquals("is_active", ColumnNames.snakeCase("isActive"));
    }

    @Test
    void acronyms_and_digits_split() {
        assertEquals("http_server", ColumnNames.snakeCase("HTTPServer"));
        assertEquals("user_id", ColumnNames.snakeCase("userID"));
        assertEquals("name_1", ColumnNames.snakeCase("name1"));
        assertEquals("level_3_value", ColumnNames.snakeCase("level3Value"));
    }

    @Test
    void existing_separators_collapse() {
        assertEquals("created_at", ColumnNames.snakeCase("created_at"));
        assertEquals("created_at", ColumnNames.snakeCase("created__At_"));
    }

    @Test
    void qualify_prefixes_alias() {
        assertEquals("u.name", ColumnNames.qualify("u", "name"));
        assertEquals("name", ColumnNames.qualify(null, "name"));
        assertEquals("name", ColumnNames.qualify("", "name"));
    }
}
