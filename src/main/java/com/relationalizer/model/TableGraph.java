package com.relationalizer.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The root table and every table extracted from lists, kept in dependency order: a table always
 * comes after the tables its reference columns point to. Table names are case-insensitive, as in
 * SQLite.
 */
public class TableGraph {

    private final String rootTableName;
    private final Map<String, TableSchema> tablesByName;
    private final List<TableSchema> dependencyOrder;
    private final boolean projection;

    private TableGraph(String rootTableName, Collection<TableSchema> tables, boolean projection) {
        this.rootTableName = rootTableName;
        this.projection = projection;
        this.tablesByName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (TableSchema table : tables) {
            tablesByName.put(table.getName(), table);
        }
        this.dependencyOrder = List.copyOf(orderByDependency());
    }

    public static TableGraph of(String rootTableName, Collection<TableSchema> tables) {
        return new TableGraph(rootTableName, tables, false);
    }

    /**
     * A graph restricted to a subset of the discovered tables and columns. Rows for tables
     * outside a projection are expected and dropped without warning.
     */
    public static TableGraph projection(String rootTableName, Collection<TableSchema> tables) {
        return new TableGraph(rootTableName, tables, true);
    }

    public String getRootTableName() {
        return rootTableName;
    }

    public boolean isProjection() {
        return projection;
    }

    public Optional<TableSchema> getRoot() {
        return table(rootTableName);
    }

    public Optional<TableSchema> table(String name) {
        return Optional.ofNullable(tablesByName.get(name));
    }

    public boolean contains(String name) {
        return tablesByName.containsKey(name);
    }

    /**
     * Tables with referenced (child) tables first.
     */
    public List<TableSchema> getTables() {
        return dependencyOrder;
    }

    public int size() {
        return dependencyOrder.size();
    }

    private List<TableSchema> orderByDependency() {
        List<TableSchema> order = new ArrayList<>();
        Set<String> visited = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        TableSchema root = tablesByName.get(rootTableName);
        if (root != null) {
            visit(root, visited, order);
        }
        for (TableSchema table : tablesByName.values()) {
            visit(table, visited, order);
        }
        return order;
    }

    private void visit(TableSchema table, Set<String> visited, List<TableSchema> order) {
        if (!visited.add(table.getName())) {
            return;
        }
        Set<String> children = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        children.addAll(table.referencedTables());
        for (String child : children) {
            TableSchema childTable = tablesByName.get(child);
            if (childTable != null) {
                visit(childTable, visited, order);
            }
        }
        order.add(table);
    }
}
