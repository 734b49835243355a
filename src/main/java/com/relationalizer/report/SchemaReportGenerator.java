package com.relationalizer.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.relationalizer.exception.RelationalizerException;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.PathStatistic;
import com.relationalizer.model.ShapeConflict;
import com.relationalizer.model.TableSchema;
import com.relationalizer.model.TypeTag;
import com.relationalizer.pipeline.SchemaAnalysis;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the schema report of an analysis: corpus size, observed paths, shape conflicts and
 * the derived tables.
 */
public class SchemaReportGenerator {

    private static final String TEMPLATE = "schema-report.ftl";

    private final Configuration freemarkerConfig;

    public SchemaReportGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String generate(SchemaAnalysis analysis) {
        Map<String, Object> model = new HashMap<>();
        AggregateSchema aggregate = analysis.getAggregate();
        model.put("documentCount", String.valueOf(aggregate.getDocumentCount()));
        model.put("documentsRead", String.valueOf(analysis.getDocumentsRead()));
        model.put("rejectedCount", analysis.getFailures().size());
        model.put("paths", buildPaths(aggregate));
        model.put("conflicts", buildConflicts(aggregate));
        model.put("tables", buildTables(analysis));

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter writer = new StringWriter();
            template.process(model, writer);
            return writer.toString();
        } catch (IOException | TemplateException e) {
            throw new RelationalizerException("Failed to render schema report", e);
        }
    }

    private List<Map<String, Object>> buildPaths(AggregateSchema aggregate) {
        List<Map<String, Object>> paths = new ArrayList<>();
        for (PathStatistic stat : aggregate.paths()) {
            Map<String, Object> path = new LinkedHashMap<>();
            path.put("path", stat.getPath());
            path.put("counts", stat.getProfile().describeCounts());
            path.put("presence", stat.getObservations() + "/" + stat.getOwnerObservations());
            path.put("alwaysPresent", stat.isAlwaysPresent());
            path.put("conflict", stat.getProfile().hasShapeConflict());
            paths.add(path);
        }
        return paths;
    }

    private List<Map<String, Object>> buildConflicts(AggregateSchema aggregate) {
        List<Map<String, Object>> conflicts = new ArrayList<>();
        for (ShapeConflict conflict : aggregate.shapeConflicts()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", conflict.getPath());
            List<String> counts = new ArrayList<>();
            for (Map.Entry<TypeTag, Long> count : conflict.getCounts().entrySet()) {
                counts.add(count.getKey().name() + ": " + count.getValue());
            }
            entry.put("counts", String.join(", ", counts));
            conflicts.add(entry);
        }
        return conflicts;
    }

    private List<Map<String, Object>> buildTables(SchemaAnalysis analysis) {
        List<Map<String, Object>> tables = new ArrayList<>();
        for (TableSchema table : analysis.getTableGraph().getTables()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", table.getName());
            entry.put("depth", String.valueOf(table.getDepth()));
            entry.put("rows", String.valueOf(table.getRowObservations()));
            entry.put("sources", String.join(", ", table.getSourcePaths()));
            entry.put("everyDocument", table.isPopulatedInEveryDocument());
            List<Map<String, Object>> columns = new ArrayList<>();
            for (ColumnSchema column : table.getColumns()) {
                Map<String, Object> col = new LinkedHashMap<>();
                col.put("name", column.getName());
                col.put("type", column.getSqlType().name());
                col.put("flags", flags(column));
                col.put("source", column.getSourcePathText());
                columns.add(col);
            }
            entry.put("columns", columns);
            tables.add(entry);
        }
        return tables;
    }

    private static String flags(ColumnSchema column) {
        List<String> flags = new ArrayList<>();
        if (column.isPrimaryKey()) {
            flags.add("PK");
        }
        if (!column.isNullable()) {
            flags.add("NOT NULL");
        }
        if (column.isReference()) {
            flags.add(column.getReferencedTable() != null ? "-> " + column.getReferencedTable() : "-> (empty)");
        }
        return String.join(" ", flags);
    }
}
