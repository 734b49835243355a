package com.relationalizer.split;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnKind;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.model.SplitDocument;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableRow;
import com.relationalizer.model.TableSchema;
import com.relationalizer.model.TypeProfile;
import com.relationalizer.model.TypeTag;
import com.relationalizer.normalize.IdentifierKeys;
import com.relationalizer.profile.SchemaMerger;
import com.relationalizer.sql.ColumnTypeResolver;

/**
 * Decomposes documents into tables. Lists become child tables named after their key, nested
 * objects are flattened into their row with {@code _}-joined column names.
 *
 * Schema mode works on the aggregate profile and produces the {@link TableGraph}; row mode
 * works on one normalized document and produces its rows. Both walk the tree the same way so
 * rows line up with the discovered schema.
 */
public class TableSplitter {
    private static final Logger log = LoggerFactory.getLogger(TableSplitter.class);

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final SchemaMerger merger;
    private final ColumnTypeResolver typeResolver;
    private final ColumnNamer columnNamer = new ColumnNamer();

    public TableSplitter(SchemaMerger merger, ColumnTypeResolver typeResolver) {
        this.merger = merger;
        this.typeResolver = typeResolver;
    }

    // ---- schema mode ----

    public TableGraph split(AggregateSchema schema, String rootTableName) {
        TypeProfile root = schema.getRoot();
        long documents = schema.getDocumentCount();

        Map<String, TableOccurrences> occurrences = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        occurrences.computeIfAbsent(rootTableName, TableOccurrences::new)
                .add(AggregateSchema.ROOT_PATH, rootTableName, root, 0, documents > 0);
        collectLists(rootTableName, rootTableName, root, List.of(), AggregateSchema.ROOT_PATH, 1,
                documents > 0, documents, occurrences);

        List<TableSchema> tables = new ArrayList<>();
        for (TableOccurrences table : occurrences.values()) {
            tables.add(buildTable(rootTableName, table));
        }
        log.debug("Derived {} tables from {} documents", tables.size(), documents);
        return TableGraph.of(rootTableName, tables);
    }

    /**
     * Registers every list under {@code node} as a table occurrence. Lists inside flattened
     * objects belong to the same owner; lists inside list members belong to the member table.
     */
    private void collectLists(String rootTableName, String owner, TypeProfile node, List<String> segments,
                              String path, int depth, boolean ownerGuaranteed, long ownerRows,
                              Map<String, TableOccurrences> occurrences) {
        for (Map.Entry<String, TypeProfile> field : node.getFields().entrySet()) {
            TypeProfile child = field.getValue();
            List<String> childSegments = append(segments, field.getKey());
            String childPath = path + "." + field.getKey();

            if (child.count(TypeTag.OBJECT) > 0) {
                collectLists(rootTableName, owner, child, childSegments, childPath, depth, ownerGuaranteed,
                        ownerRows, occurrences);
            }

            Optional<TypeProfile> element = child.getElement();
            if (element.isPresent()) {
                String table = TableNaming.childTableName(rootTableName, owner, childSegments);
                boolean guaranteed = ownerGuaranteed && ownerRows > 0 && child.getPopulatedLists() == ownerRows;
                String elementPath = childPath + "[]";
                occurrences.computeIfAbsent(table, TableOccurrences::new)
                        .add(elementPath, field.getKey(), element.get(), depth, guaranteed);
                collectLists(rootTableName, table, element.get(), List.of(), elementPath, depth + 1, guaranteed,
                        element.get().count(TypeTag.OBJECT), occurrences);
            }
        }
    }

    private TableSchema buildTable(String rootTableName, TableOccurrences table) {
        TypeProfile rowProfile = table.profile;
        long rows = rowProfile.count(TypeTag.OBJECT);

        List<ColumnDraft> drafts = new ArrayList<>();
        collectColumns(rootTableName, table.name, rowProfile, List.of(), drafts);

        ColumnNamer.Assignment naming = columnNamer.assign(table.name, drafts.stream().map(ColumnDraft::path).toList());
        if (!naming.getCollisions().isEmpty()) {
            log.warn("Table {} has {} unresolvable column name collisions", table.name, naming.getCollisions().size());
        }

        List<ColumnSchema> columns = new ArrayList<>();
        ColumnDraft primaryKey = choosePrimaryKey(drafts, rows, table.ownerKey);
        for (ColumnDraft draft : drafts) {
            String name = naming.getNames().get(draft.path());
            if (name == null) {
                continue;
            }
            boolean notNull = table.guaranteed && rows > 0 && draft.present() == rows
                    && draft.profile().count(TypeTag.NULL) == 0;
            columns.add(ColumnSchema.builder()
                    .name(name)
                    .sourcePath(draft.path())
                    .sqlType(typeResolver.resolve(draft.path(), draft.profile(), draft.reference()))
                    .nullable(!notNull)
                    .primaryKey(draft == primaryKey)
                    .kind(draft.reference() ? ColumnKind.REFERENCE : ColumnKind.VALUE)
                    .referencedTable(draft.referencedTable())
                    .observedTags(draft.profile().getCounts())
                    .build());
        }

        return TableSchema.builder()
                .name(table.name)
                .depth(table.depth)
                .sourcePaths(table.paths)
                .rowObservations(rows)
                .populatedInEveryDocument(table.guaranteed)
                .columns(columns)
                .collisions(naming.getCollisions())
                .build();
    }

    private void collectColumns(String rootTableName, String table, TypeProfile node, List<String> segments,
                                List<ColumnDraft> drafts) {
        for (Map.Entry<String, TypeProfile> field : node.getFields().entrySet()) {
            TypeProfile child = field.getValue();
            List<String> childSegments = append(segments, field.getKey());
            boolean list = child.count(TypeTag.LIST) > 0;
            boolean object = child.count(TypeTag.OBJECT) > 0;
            boolean onlyNull = child.count(TypeTag.NULL) > 0 && !object;

            if (list || child.nonNullScalarCount() > 0 || onlyNull) {
                String referenced = child.getElement().isPresent()
                        ? TableNaming.childTableName(rootTableName, table, childSegments)
                        : null;
                drafts.add(new ColumnDraft(childSegments, child, list, referenced,
                        child.nonNullScalarCount() + child.count(TypeTag.LIST)));
            }
            if (object) {
                collectColumns(rootTableName, table, child, childSegments, drafts);
            }
        }
    }

    /**
     * Only top-level, always present, never null columns that identify the row itself qualify.
     * Ranked the way {@link IdentifierKeys#choose} ranks a row's keys, so the key stored in a
     * parent's reference column and the child's primary key agree.
     */
    private static ColumnDraft choosePrimaryKey(List<ColumnDraft> drafts, long rows, String ownerKey) {
        return drafts.stream()
                .filter(d -> !d.reference() && d.path().size() == 1)
                .filter(d -> IdentifierKeys.isRowIdentity(d.path().get(0), ownerKey))
                .filter(d -> rows > 0 && d.present() == rows && d.profile().count(TypeTag.NULL) == 0)
                .filter(d -> !d.profile().hasShapeConflict())
                .filter(d -> d.profile().scalarValueTags().stream()
                        .allMatch(t -> t == TypeTag.INTEGER || t == TypeTag.STRING))
                .min(Comparator.comparingInt((ColumnDraft d) -> IdentifierKeys.rank(d.path().get(0)))
                        .thenComparing(d -> d.path().get(0), String.CASE_INSENSITIVE_ORDER))
                .orElse(null);
    }

    // ---- row mode ----

    public SplitDocument split(NormalizedDocument document, String rootTableName) {
        List<TableRow> rows = new ArrayList<>();
        splitRow(document.getRoot(), rootTableName, rootTableName, rootTableName, rows);
        return new SplitDocument(document.getDocumentId(), List.copyOf(rows));
    }

    /**
     * Emits the rows of an object's lists first, then the object's own row.
     *
     * @param ownerKey key of the list holding the object, or the root table name
     */
    private TableRow splitRow(ObjectNode object, String table, String ownerKey, String rootTableName,
                              List<TableRow> rows) {
        Map<List<String>, JsonNode> values = new LinkedHashMap<>();
        Map<List<String>, List<TableRow>> children = new LinkedHashMap<>();
        flattenRow(object, List.of(), table, rootTableName, values, children, rows);
        JsonNode identity = IdentifierKeys.identityKey(object, ownerKey)
                .map(object::get)
                .orElse(NODES.nullNode());
        TableRow row = new TableRow(table, values, children, identity);
        rows.add(row);
        return row;
    }

    private void flattenRow(ObjectNode node, List<String> segments, String table, String rootTableName,
                            Map<List<String>, JsonNode> values, Map<List<String>, List<TableRow>> children,
                            List<TableRow> rows) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            List<String> childSegments = append(segments, field.getKey());
            JsonNode value = field.getValue();

            if (value.isObject()) {
                flattenRow((ObjectNode) value, childSegments, table, rootTableName, values, children, rows);
            } else if (value.isArray()) {
                String childTable = TableNaming.childTableName(rootTableName, table, childSegments);
                ArrayNode references = NODES.arrayNode();
                List<TableRow> members = new ArrayList<>();
                for (JsonNode member : value) {
                    if (!member.isObject()) {
                        throw new IllegalArgumentException("List member at " + table + "." + String.join(".", childSegments)
                                + " is not an object; documents must be normalized before splitting");
                    }
                    TableRow memberRow = splitRow((ObjectNode) member, childTable, field.getKey(), rootTableName, rows);
                    members.add(memberRow);
                    references.add(memberRow.getIdentity());
                }
                values.put(childSegments, references);
                children.put(childSegments, List.copyOf(members));
            } else {
                values.put(childSegments, value);
            }
        }
    }

    private static List<String> append(List<String> segments, String key) {
        List<String> result = new ArrayList<>(segments.size() + 1);
        result.addAll(segments);
        result.add(key);
        return List.copyOf(result);
    }

    private record ColumnDraft(List<String> path, TypeProfile profile, boolean reference, String referencedTable,
                               long present) {
    }

    /**
     * Every list path that maps to one table name, with their element profiles merged.
     */
    private final class TableOccurrences {
        private final String name;
        private final List<String> paths = new ArrayList<>();
        private String ownerKey;
        private TypeProfile profile = TypeProfile.empty();
        private boolean guaranteed = true;
        private int depth;

        TableOccurrences(String name) {
            this.name = name;
        }

        void add(String path, String key, TypeProfile rowProfile, int occurrenceDepth, boolean occurrenceGuaranteed) {
            paths.add(path);
            if (ownerKey == null) {
                ownerKey = key;
            }
            profile = merger.merge(profile, rowProfile);
            guaranteed = guaranteed && occurrenceGuaranteed;
            depth = Math.max(depth, occurrenceDepth);
        }
    }
}
