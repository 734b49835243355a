package com.relationalizer.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A table derived from the aggregate schema: the root table or one extracted from lists.
 */
@Value
@Builder(toBuilder = true)
public class TableSchema {
    @NonNull String name;
    int depth;
    /** Absolute list paths (or {@code $} for the root) whose members form this table's rows. */
    @Singular List<String> sourcePaths;
    long rowObservations;
    boolean populatedInEveryDocument;
    @Singular List<ColumnSchema> columns;
    @Singular List<ColumnNameCollision> collisions;

    public Optional<ColumnSchema> getPrimaryKey() {
        return columns.stream().filter(ColumnSchema::isPrimaryKey).findFirst();
    }

    public Optional<ColumnSchema> column(List<String> sourcePath) {
        return columns.stream().filter(c -> c.getSourcePath().equals(sourcePath)).findFirst();
    }

    public Optional<ColumnSchema> columnNamed(String columnName) {
        return columns.stream().filter(c -> c.getName().equalsIgnoreCase(columnName)).findFirst();
    }

    public Set<String> referencedTables() {
        Set<String> referenced = new LinkedHashSet<>();
        for (ColumnSchema column : columns) {
            if (column.isReference() && column.getReferencedTable() != null) {
                referenced.add(column.getReferencedTable());
            }
        }
        return referenced;
    }
}
