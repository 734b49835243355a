package com.relationalizer.sql;

/**
 * Serialization of child keys in a parent's reference column.
 */
public enum ReferenceFormat {
    /** {@code [12,34]}, {@code []} when the list was empty. */
    JSON_ARRAY,
    /** Keys joined by the configured delimiter, empty string when the list was empty. */
    DELIMITED
}
