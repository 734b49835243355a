package com.relationalizer.model;

import java.util.List;

import lombok.Value;

/**
 * A source path for which every candidate column name was already taken.
 */
@Value
public class ColumnNameCollision {
    String tableName;
    List<String> sourcePath;
    List<String> attemptedNames;

    public String describe() {
        return String.join(".", sourcePath) + " (tried " + String.join(", ", attemptedNames) + ")";
    }
}
