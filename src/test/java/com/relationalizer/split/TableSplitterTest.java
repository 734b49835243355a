package com.relationalizer.split;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnKind;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.model.RawDocument;
import com.relationalizer.model.SplitDocument;
import com.relationalizer.model.SqlType;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableRow;
import com.relationalizer.model.TableSchema;
import com.relationalizer.normalize.DocumentNormalizer;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.profile.SchemaMerger;
import com.relationalizer.profile.TypeProfiler;
import com.relationalizer.sql.ColumnTypeResolver;
import com.relationalizer.sql.TypeInferencePolicy;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TableSplitter.
 */
class TableSplitterTest {

    private static final String ROOT = "Listings";

    private final ObjectMapper mapper = new ObjectMapper();
    private final SchemaMerger merger = new SchemaMerger();
    private final TypeProfiler profiler = new TypeProfiler(merger);
    private final DocumentNormalizer normalizer = new DocumentNormalizer(RelationalizerConfig.defaults(), mapper);
    private final TableSplitter splitter =
            new TableSplitter(merger, new ColumnTypeResolver(TypeInferencePolicy.TEXT_DEFAULT));

    private List<NormalizedDocument> normalize(String... documents) {
        List<NormalizedDocument> normalized = new ArrayList<>();
        for (int i = 0; i < documents.length; i++) {
            normalized.add(normalizer.normalize(new RawDocument("doc" + i, documents[i], Instant.EPOCH)));
        }
        return normalized;
    }

    private TableGraph graph(String... documents) {
        AggregateSchema schema = merger.aggregate(normalize(documents).stream().map(profiler::profile));
        return splitter.split(schema, ROOT);
    }

    private static List<String> columnNames(TableSchema table) {
        return table.getColumns().stream().map(ColumnSchema::getName).toList();
    }

    @Test
    void testListingWithPhones() {
        TableGraph graph = graph(
                "{\"Id\": \"A\", \"Phones\": [{\"PhoneNumber\": \"555\"}]}",
                "{\"Id\": \"B\", \"Phones\": []}");

        assertThat(graph.getTables()).extracting(TableSchema::getName).containsExactly("Phones", "Listings");

        TableSchema listings = graph.table("Listings").orElseThrow();
        assertThat(columnNames(listings)).containsExactly("Id", "Phones");
        ColumnSchema id = listings.columnNamed("Id").orElseThrow();
        assertThat(id.isPrimaryKey()).isTrue();
        assertThat(id.isNullable()).isFalse();
        assertThat(id.getSqlType()).isEqualTo(SqlType.TEXT);
        ColumnSchema phones = listings.columnNamed("Phones").orElseThrow();
        assertThat(phones.getKind()).isEqualTo(ColumnKind.REFERENCE);
        assertThat(phones.getReferencedTable()).isEqualTo("Phones");
        assertThat(phones.isNullable()).isFalse();
        assertThat(listings.isPopulatedInEveryDocument()).isTrue();

        TableSchema phoneTable = graph.table("Phones").orElseThrow();
        assertThat(columnNames(phoneTable)).containsExactly("PhoneNumber", "PhonesGeneratedId");
        assertThat(phoneTable.getPrimaryKey()).map(ColumnSchema::getName).contains("PhonesGeneratedId");
        assertThat(phoneTable.columnNamed("PhonesGeneratedId").orElseThrow().getSqlType()).isEqualTo(SqlType.INTEGER);
        assertThat(phoneTable.columnNamed("PhoneNumber").orElseThrow().isNullable()).isTrue();
        assertThat(phoneTable.isPopulatedInEveryDocument()).isFalse();
        assertThat(phoneTable.getSourcePaths()).containsExactly("$.Phones[]");
        assertThat(phoneTable.getDepth()).isEqualTo(1);
        assertThat(phoneTable.getRowObservations()).isEqualTo(1);
    }

    @Test
    void testGuaranteedChildTableHasNotNullColumns() {
        TableGraph graph = graph(
                "{\"Id\": \"A\", \"Phones\": [{\"PhoneNumber\": \"1\"}]}",
                "{\"Id\": \"B\", \"Phones\": [{\"PhoneNumber\": \"2\"}, {\"PhoneNumber\": \"3\"}]}");

        TableSchema phones = graph.table("Phones").orElseThrow();
        assertThat(phones.isPopulatedInEveryDocument()).isTrue();
        assertThat(phones.columnNamed("PhoneNumber").orElseThrow().isNullable()).isFalse();
        assertThat(phones.columnNamed("PhonesGeneratedId").orElseThrow().isNullable()).isFalse();
    }

    @Test
    void testNestedObjectsAreFlattened() {
        TableGraph graph = graph("""
                {"Id": 1, "Property": {"Beds": 3, "Address": {"City": "Austin"}}}
                """);

        TableSchema listings = graph.getRoot().orElseThrow();
        assertThat(columnNames(listings)).containsExactly("Id", "Property_Address_City", "Property_Beds");
        assertThat(listings.columnNamed("Property_Address_City").orElseThrow().getSourcePath())
                .containsExactly("Property", "Address", "City");
        assertThat(listings.columnNamed("Id").orElseThrow().getSqlType()).isEqualTo(SqlType.INTEGER);
    }

    @Test
    void testNestedListsBecomeNestedTables() {
        TableGraph graph = graph("""
                {"Id": 1, "Individual": [{"Name": "Kim", "Phones": [{"Number": "1"}]}]}
                """);

        assertThat(graph.getTables()).extracting(TableSchema::getName)
                .containsExactly("Phones", "Individual", "Listings");
        TableSchema individual = graph.table("Individual").orElseThrow();
        assertThat(individual.getDepth()).isEqualTo(1);
        assertThat(individual.referencedTables()).containsExactly("Phones");
        TableSchema phones = graph.table("Phones").orElseThrow();
        assertThat(phones.getDepth()).isEqualTo(2);
        assertThat(phones.getSourcePaths()).containsExactly("$.Individual[].Phones[]");
    }

    @Test
    void testListsWithSameKeyShareOneTable() {
        TableGraph graph = graph("""
                {"Id": 1, "A": {"Photos": [{"Url": "x"}]}, "B": {"Photos": [{"Url": "y", "Size": 2}]}}
                """);

        TableSchema photos = graph.table("Photos").orElseThrow();
        assertThat(photos.getSourcePaths()).containsExactly("$.A.Photos[]", "$.B.Photos[]");
        assertThat(columnNames(photos)).containsExactly("PhotosGeneratedId", "Size", "Url");
        TableSchema listings = graph.getRoot().orElseThrow();
        assertThat(listings.columnNamed("A_Photos").orElseThrow().getReferencedTable()).isEqualTo("Photos");
        assertThat(listings.columnNamed("B_Photos").orElseThrow().getReferencedTable()).isEqualTo("Photos");
        assertThat(graph.size()).isEqualTo(2);
    }

    @Test
    void testListNamedLikeRootTableIsRenamed() {
        TableGraph graph = graph("""
                {"Id": 1, "listings": [{"Name": "x"}]}
                """);

        assertThat(graph.contains("Listings_listings")).isTrue();
        assertThat(graph.getRoot().orElseThrow().columnNamed("listings").orElseThrow().getReferencedTable())
                .isEqualTo("Listings_listings");
    }

    @Test
    void testNoPrimaryKeyWhenIdentifierMissingInSomeRows() {
        TableGraph graph = graph("{\"Id\": 1}", "{\"Name\": \"x\"}");

        TableSchema listings = graph.getRoot().orElseThrow();
        assertThat(listings.getPrimaryKey()).isEmpty();
        assertThat(listings.columnNamed("Id").orElseThrow().isNullable()).isTrue();
    }

    @Test
    void testPrimaryKeyRejectsFloatIdentifier() {
        TableGraph graph = graph("{\"Id\": 1.5, \"ListingId\": \"L1\"}", "{\"Id\": 2.5, \"ListingId\": \"L2\"}");

        assertThat(graph.getRoot().orElseThrow().getPrimaryKey()).map(ColumnSchema::getName).contains("ListingId");
    }

    @Test
    void testNullOnlyPathIsNullableTextColumn() {
        TableGraph graph = graph("{\"Id\": 1, \"Remarks\": null}", "{\"Id\": 2, \"Remarks\": null}");

        ColumnSchema remarks = graph.getRoot().orElseThrow().columnNamed("Remarks").orElseThrow();
        assertThat(remarks.isNullable()).isTrue();
        assertThat(remarks.getSqlType()).isEqualTo(SqlType.TEXT);
    }

    @Test
    void testNullNextToObjectAddsNoColumn() {
        TableGraph graph = graph("{\"Id\": 1, \"Address\": null}", "{\"Id\": 2, \"Address\": {\"City\": \"X\"}}");

        assertThat(columnNames(graph.getRoot().orElseThrow())).containsExactly("Address_City", "Id");
    }

    @Test
    void testEmptyCorpusYieldsColumnlessRoot() {
        TableGraph graph = splitter.split(AggregateSchema.empty(), ROOT);

        assertThat(graph.size()).isEqualTo(1);
        assertThat(graph.getRoot().orElseThrow().getColumns()).isEmpty();
    }

    @Test
    void testEveryObservedPathIsStored() {
        TableGraph graph = graph(
                "{\"Id\": 1, \"Property\": {\"Beds\": 2}, \"Agents\": [{\"AgentId\": 5, \"Office\": {\"Name\": \"O\"}}]}",
                "{\"Id\": 2, \"Price\": 10, \"Agents\": [{\"AgentId\": 6, \"Mobile\": true}]}");

        assertThat(columnNames(graph.table("Listings").orElseThrow()))
                .containsExactlyInAnyOrder("Id", "Agents", "Price", "Property_Beds");
        assertThat(columnNames(graph.table("Agents").orElseThrow()))
                .containsExactlyInAnyOrder("AgentId", "Mobile", "Office_Name");
        assertThat(graph.table("Agents").orElseThrow().getPrimaryKey()).map(ColumnSchema::getName).contains("AgentId");
    }

    @Test
    void testRowsOfDocumentChildFirst() {
        NormalizedDocument document = normalize("{\"Id\": \"A\", \"Phones\": [{\"PhoneNumber\": \"555\"}]}").get(0);

        SplitDocument split = splitter.split(document, ROOT);

        assertThat(split.getRows()).extracting(TableRow::getTableName).containsExactly("Phones", "Listings");
        TableRow phone = split.rowsFor("Phones").get(0);
        TableRow listing = split.rowsFor("Listings").get(0);
        JsonNode phoneId = phone.value(List.of("PhonesGeneratedId"));
        assertThat(phone.getIdentity()).isEqualTo(phoneId);
        assertThat(listing.getIdentity().asText()).isEqualTo("A");
        assertThat(listing.value(List.of("Phones")).isArray()).isTrue();
        assertThat(listing.value(List.of("Phones")).get(0)).isEqualTo(phoneId);
    }

    @Test
    void testTypeCodeIsNotChosenAsPrimaryKey() {
        TableGraph graph = graph(
                "{\"Id\": 2, \"Phones\": [{\"PhoneTypeId\": 1, \"PhoneNumber\": \"555\"}, {\"PhoneTypeId\": 1, \"PhoneNumber\": \"777\"}]}");

        TableSchema phones = graph.table("Phones").orElseThrow();
        assertThat(columnNames(phones)).containsExactly("PhoneNumber", "PhoneTypeId", "PhonesGeneratedId");
        assertThat(phones.getPrimaryKey()).map(ColumnSchema::getName).contains("PhonesGeneratedId");
    }

    @Test
    void testPrimaryKeyAndRowIdentityAgreeWithTwoIdColumns() {
        String doc = "{\"Id\": 1, \"Agents\": [{\"OfficeId\": 100, \"AgentId\": 7}, {\"OfficeId\": 100, \"AgentId\": 9}]}";
        TableGraph graph = graph(doc);

        assertThat(graph.table("Agents").orElseThrow().getPrimaryKey()).map(ColumnSchema::getName).contains("AgentId");

        SplitDocument split = splitter.split(normalize(doc).get(0), ROOT);
        assertThat(split.rowsFor("Agents")).extracting(row -> row.getIdentity().asInt()).containsExactly(7, 9);
        TableRow listing = split.rowsFor("Listings").get(0);
        assertThat(listing.children(List.of("Agents"))).hasSize(2);
        assertThat(listing.children(List.of("Agents")).get(1).value(List.of("OfficeId")).asInt()).isEqualTo(100);
    }

    @Test
    void testRowOfEmptyListHasEmptyReferences() {
        NormalizedDocument document = normalize("{\"Id\": \"B\", \"Phones\": []}").get(0);

        SplitDocument split = splitter.split(document, ROOT);

        assertThat(split.getRows()).hasSize(1);
        assertThat(split.getRows().get(0).value(List.of("Phones"))).isEmpty();
    }

    @Test
    void testRowSplitRejectsUnnormalizedList() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree("{\"Id\": 1, \"Tags\": [\"a\"]}");
        NormalizedDocument document = new NormalizedDocument("raw", root, Instant.EPOCH);

        assertThatThrownBy(() -> splitter.split(document, ROOT))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not an object");
    }
}
