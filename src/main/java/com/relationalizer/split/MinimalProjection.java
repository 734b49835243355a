package com.relationalizer.split;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableSchema;
import com.relationalizer.normalize.ComputedColumns;
import com.relationalizer.rules.TransformRules;

/**
 * Reduces a table graph to the root table with the columns marked {@code MINIMAL} plus its
 * primary key.
 */
public class MinimalProjection {
    private static final Logger log = LoggerFactory.getLogger(MinimalProjection.class);

    private final TransformRules rules;

    public MinimalProjection(TransformRules rules) {
        this.rules = rules;
    }

    public TableGraph apply(TableGraph graph) {
        if (rules.getMinimalRules().isEmpty()) {
            log.warn("Minimal mode without MINIMAL rules keeps only the primary key of {}", graph.getRootTableName());
        }
        return graph.getRoot()
                .map(root -> TableGraph.projection(graph.getRootTableName(), List.of(project(root))))
                .orElseGet(() -> TableGraph.projection(graph.getRootTableName(), List.of()));
    }

    private TableSchema project(TableSchema root) {
        List<ColumnSchema> kept = root.getColumns().stream()
                .filter(c -> c.isPrimaryKey() || rules.isMinimal(pathOf(c)) || ComputedColumns.isComputed(c.getSourcePath()))
                .map(c -> c.isReference() ? c.toBuilder().referencedTable(null).build() : c)
                .toList();
        return root.toBuilder().clearColumns().columns(kept).build();
    }

    private static String pathOf(ColumnSchema column) {
        return AggregateSchema.ROOT_PATH + "." + column.getSourcePathText();
    }
}
