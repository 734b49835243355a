package com.relationalizer.sql;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Renders JSON scalar values as SQLite literals.
 */
public final class SqlLiterals {

    private SqlLiterals() {
        // Utility class
    }

    public static String literal(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "NULL";
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? "1" : "0";
        }
        if (value.isNumber()) {
            return value.asText();
        }
        if (value.isTextual()) {
            return quote(value.textValue());
        }
        return quote(value.toString());
    }

    public static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }
}
