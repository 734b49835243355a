package com.relationalizer.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.exception.ColumnNameCollisionException;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableSchema;

/**
 * Generates {@code CREATE TABLE IF NOT EXISTS} statements, referenced tables first.
 */
public class DdlGenerator {
    private static final Logger log = LoggerFactory.getLogger(DdlGenerator.class);

    public List<String> generate(TableGraph graph) {
        List<String> statements = new ArrayList<>();
        for (TableSchema table : graph.getTables()) {
            if (!table.getCollisions().isEmpty()) {
                throw new ColumnNameCollisionException(table.getName(), table.getCollisions());
            }
            if (table.getColumns().isEmpty()) {
                log.warn("Table {} has no columns and is not created", table.getName());
                continue;
            }
            statements.add(createTable(table));
        }
        return statements;
    }

    public String createTable(TableSchema table) {
        return "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.quote(table.getName()) + " ("
                + table.getColumns().stream().map(this::columnDefinition).collect(Collectors.joining(", "))
                + ");";
    }

    private String columnDefinition(ColumnSchema column) {
        StringBuilder sb = new StringBuilder();
        sb.append(SqlIdentifiers.quote(column.getName())).append(' ').append(column.getSqlType().name());
        if (column.isPrimaryKey()) {
            sb.append(" PRIMARY KEY");
        }
        if (!column.isNullable()) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }
}
