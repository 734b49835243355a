package com.relationalizer.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.relationalizer.model.ColumnNameCollision;

/**
 * Raised at DDL generation when a table holds source paths that could not be given distinct
 * column names.
 */
public class ColumnNameCollisionException extends RelationalizerException {

    private static final long serialVersionUID = 1L;
    private final transient List<ColumnNameCollision> collisions;

    public ColumnNameCollisionException(String tableName, List<ColumnNameCollision> collisions) {
        super("Table " + tableName + " has unresolvable column name collisions: "
                + collisions.stream().map(ColumnNameCollision::describe).collect(Collectors.joining("; ")));
        this.collisions = List.copyOf(collisions);
    }

    public List<ColumnNameCollision> getCollisions() {
        return collisions;
    }
}
