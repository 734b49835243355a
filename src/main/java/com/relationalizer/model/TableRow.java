package com.relationalizer.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.Value;

/**
 * Values of one row produced from one (sub)object of a normalized document, keyed by source
 * path relative to the row object. Reference paths map to an array of child identities, and
 * to the child rows themselves in {@link #getChildren()}.
 */
@Value
public class TableRow {
    String tableName;
    Map<List<String>, JsonNode> values;
    Map<List<String>, List<TableRow>> children;
    /** Identity of this row as stored in the parent's reference column when its table has no primary key. */
    JsonNode identity;

    public JsonNode value(List<String> sourcePath) {
        return values.get(sourcePath);
    }

    public List<TableRow> children(List<String> sourcePath) {
        return children.getOrDefault(sourcePath, List.of());
    }
}
