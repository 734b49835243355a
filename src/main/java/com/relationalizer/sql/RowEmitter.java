package com.relationalizer.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.relationalizer.exception.RowValidationException;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.model.RawDocument;
import com.relationalizer.model.SplitDocument;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableRow;
import com.relationalizer.model.TableSchema;
import com.relationalizer.normalize.DocumentNormalizer;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.split.TableSplitter;

/**
 * Produces the inserts for one raw document against a discovered table graph. Holds no state
 * between documents.
 */
public class RowEmitter {
    private static final Logger log = LoggerFactory.getLogger(RowEmitter.class);

    private final DocumentNormalizer normalizer;
    private final TableSplitter splitter;
    private final ObjectMapper mapper;
    private final ReferenceFormat referenceFormat;
    private final String delimiter;
    private final PriceHistory priceHistory;

    public RowEmitter(RelationalizerConfig config, DocumentNormalizer normalizer, TableSplitter splitter,
                      ObjectMapper mapper) {
        this.normalizer = normalizer;
        this.splitter = splitter;
        this.mapper = mapper;
        this.referenceFormat = config.getReferenceFormat();
        this.delimiter = config.getDelimiter();
        this.priceHistory = config.isPriceHistory() ? new PriceHistory(config) : null;
    }

    /**
     * @throws com.relationalizer.exception.MalformedDocumentException if the body cannot be normalized
     * @throws RowValidationException if any row misses a NOT NULL value; no statement of the
     *         document should be written then
     */
    public DocumentEmission emit(RawDocument raw, TableGraph graph) {
        NormalizedDocument document = normalizer.normalize(raw);
        SplitDocument split = splitter.split(document, graph.getRootTableName());

        Map<String, List<TableRow>> rowsByTable = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        Set<String> unknownTables = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (TableRow row : split.getRows()) {
            if (graph.contains(row.getTableName())) {
                rowsByTable.computeIfAbsent(row.getTableName(), k -> new ArrayList<>()).add(row);
            } else {
                unknownTables.add(row.getTableName());
            }
        }
        if (!unknownTables.isEmpty() && !graph.isProjection()) {
            log.warn("Document {}: tables {} are not part of the schema, their rows are dropped", raw.getId(), unknownTables);
        }

        List<InsertStatement> statements = new ArrayList<>();
        for (TableSchema table : graph.getTables()) {
            for (TableRow row : rowsByTable.getOrDefault(table.getName(), List.of())) {
                toInsert(raw.getId(), graph, table, row).ifPresent(statements::add);
            }
        }
        List<PriceChange> priceChanges = priceHistory == null
                ? List.of()
                : priceHistory.observe(document).stream().toList();
        return new DocumentEmission(raw.getId(), raw.getLastUpdated(), statements, priceChanges);
    }

    private Optional<InsertStatement> toInsert(String documentId, TableGraph graph, TableSchema table, TableRow row) {
        List<String> columns = new ArrayList<>();
        List<JsonNode> values = new ArrayList<>();
        for (ColumnSchema column : table.getColumns()) {
            JsonNode value = row.value(column.getSourcePath());
            if (value == null || value.isNull()) {
                if (!column.isNullable()) {
                    throw new RowValidationException(documentId, table.getName(), column.getName());
                }
                continue;
            }
            columns.add(column.getName());
            values.add(value.isArray() ? serializeReferences(referenceKeys(graph, column, row)) : value);
        }
        if (!graph.isProjection()) {
            reportUnknownPaths(documentId, table, row);
        }
        if (columns.isEmpty()) {
            log.debug("Document {}: empty row for table {} skipped", documentId, table.getName());
            return Optional.empty();
        }
        return Optional.of(new InsertStatement(table.getName(), columns, values));
    }

    private void reportUnknownPaths(String documentId, TableSchema table, TableRow row) {
        for (Map.Entry<List<String>, JsonNode> entry : row.getValues().entrySet()) {
            if (table.column(entry.getKey()).isPresent()) {
                continue;
            }
            JsonNode value = entry.getValue();
            if (value.isNull() || (value.isArray() && value.isEmpty())) {
                log.debug("Document {}: empty value at unknown path {} of {} dropped", documentId,
                        String.join(".", entry.getKey()), table.getName());
            } else {
                log.warn("Document {}: path {} is not a column of {}, value dropped", documentId,
                        String.join(".", entry.getKey()), table.getName());
            }
        }
    }

    /**
     * Primary key values of the child rows behind a reference column. Children of a table
     * without a primary key are referenced by their row identity.
     */
    private static ArrayNode referenceKeys(TableGraph graph, ColumnSchema column, TableRow row) {
        Optional<ColumnSchema> childKey = Optional.ofNullable(column.getReferencedTable())
                .flatMap(graph::table)
                .flatMap(TableSchema::getPrimaryKey);
        ArrayNode keys = JsonNodeFactory.instance.arrayNode();
        for (TableRow child : row.children(column.getSourcePath())) {
            JsonNode key = childKey.map(pk -> child.value(pk.getSourcePath())).orElse(child.getIdentity());
            keys.add(key == null ? JsonNodeFactory.instance.nullNode() : key);
        }
        return keys;
    }

    private JsonNode serializeReferences(ArrayNode references) {
        if (referenceFormat == ReferenceFormat.DELIMITED) {
            List<String> keys = new ArrayList<>();
            references.forEach(key -> keys.add(key.isNull() ? "" : key.asText()));
            return JsonNodeFactory.instance.textNode(String.join(delimiter, keys));
        }
        try {
            return JsonNodeFactory.instance.textNode(mapper.writeValueAsString(references));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize references", e);
        }
    }
}
