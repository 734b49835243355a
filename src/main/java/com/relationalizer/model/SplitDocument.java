package com.relationalizer.model;

import java.util.List;

import lombok.Value;

/**
 * Rows of one normalized document in traversal order, child rows before the row that references
 * them.
 */
@Value
public class SplitDocument {
    String documentId;
    List<TableRow> rows;

    public List<TableRow> rowsFor(String tableName) {
        return rows.stream().filter(r -> r.getTableName().equalsIgnoreCase(tableName)).toList();
    }
}
