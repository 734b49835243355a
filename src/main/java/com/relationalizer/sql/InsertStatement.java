package com.relationalizer.sql;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Value;

/**
 * One {@code INSERT OR IGNORE} row. Existing rows with the same primary key are left untouched,
 * so replaying a statement never changes the table.
 */
@Value
public class InsertStatement {
    String tableName;
    List<String> columns;
    List<JsonNode> values;

    public String toSql() {
        return prefix() + values.stream().map(SqlLiterals::literal).collect(Collectors.joining(", ")) + ");";
    }

    /**
     * Same statement with {@code ?} placeholders, for binding {@link #getValues()} over JDBC.
     */
    public String toParameterizedSql() {
        return prefix() + String.join(", ", Collections.nCopies(values.size(), "?")) + ")";
    }

    private String prefix() {
        return "INSERT OR IGNORE INTO " + SqlIdentifiers.quote(tableName) + " ("
                + columns.stream().map(SqlIdentifiers::quote).collect(Collectors.joining(", "))
                + ") VALUES (";
    }
}
