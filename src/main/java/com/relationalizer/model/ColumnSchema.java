package com.relationalizer.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One column of a generated table and the document path it is read from, relative to the
 * table's row object.
 */
@Value
@Builder(toBuilder = true)
public class ColumnSchema {
    @NonNull String name;
    @NonNull List<String> sourcePath;
    @NonNull SqlType sqlType;
    boolean nullable;
    boolean primaryKey;
    @NonNull ColumnKind kind;
    /** Child table holding the referenced rows, null when the list was never populated. */
    String referencedTable;
    @NonNull Map<TypeTag, Long> observedTags;

    public boolean isReference() {
        return kind == ColumnKind.REFERENCE;
    }

    public String getSourcePathText() {
        return String.join(".", sourcePath);
    }
}
