package com.relationalizer.sql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relationalizer.exception.ColumnNameCollisionException;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnKind;
import com.relationalizer.model.ColumnNameCollision;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.RawDocument;
import com.relationalizer.model.SqlType;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableSchema;
import com.relationalizer.model.TypeTag;
import com.relationalizer.normalize.DocumentNormalizer;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.profile.SchemaMerger;
import com.relationalizer.profile.TypeProfiler;
import com.relationalizer.split.TableSplitter;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DdlGenerator.
 */
class DdlGeneratorTest {

    private final DdlGenerator generator = new DdlGenerator();
    private final SchemaMerger merger = new SchemaMerger();

    private TableGraph graph(String... documents) {
        DocumentNormalizer normalizer = new DocumentNormalizer(RelationalizerConfig.defaults(), new ObjectMapper());
        TypeProfiler profiler = new TypeProfiler(merger);
        AggregateSchema schema = merger.aggregate(Stream.of(documents)
                .map(json -> normalizer.normalize(new RawDocument("doc", json, Instant.EPOCH)))
                .map(profiler::profile));
        return new TableSplitter(merger, new ColumnTypeResolver(TypeInferencePolicy.TEXT_DEFAULT))
                .split(schema, "Listings");
    }

    @Test
    void testListingWithPhonesDdl() {
        TableGraph graph = graph(
                "{\"Id\": \"A\", \"Phones\": [{\"PhoneNumber\": \"555\"}]}",
                "{\"Id\": \"B\", \"Phones\": []}");

        List<String> ddl = generator.generate(graph);

        assertThat(ddl).containsExactly(
                "CREATE TABLE IF NOT EXISTS Phones (PhoneNumber TEXT, PhonesGeneratedId INTEGER PRIMARY KEY);",
                "CREATE TABLE IF NOT EXISTS Listings (Id TEXT PRIMARY KEY NOT NULL, Phones TEXT NOT NULL);");
    }

    @Test
    void testReferencedTablesComeFirst() {
        TableGraph graph = graph("""
                {"Id": 1, "Individual": [{"Name": "Kim", "Phones": [{"Number": "1"}]}], "Agents": [{"AgentId": 3}]}
                """);

        List<String> ddl = generator.generate(graph);

        assertThat(ddl).hasSize(4);
        assertThat(ddl.get(0)).startsWith("CREATE TABLE IF NOT EXISTS Agents ");
        assertThat(ddl.get(1)).startsWith("CREATE TABLE IF NOT EXISTS Phones ");
        assertThat(ddl.get(2)).startsWith("CREATE TABLE IF NOT EXISTS Individual ");
        assertThat(ddl.get(3)).startsWith("CREATE TABLE IF NOT EXISTS Listings ");
    }

    @Test
    void testKeywordsAndOddNamesAreQuoted() {
        TableGraph graph = graph("""
                {"Id": 1, "Order": 2, "Group": [{"Name": "x"}], "Sq Ft": 900}
                """);

        List<String> ddl = generator.generate(graph);

        assertThat(ddl.get(0)).startsWith("CREATE TABLE IF NOT EXISTS \"Group\" (");
        assertThat(ddl.get(1)).contains("\"Order\" TEXT").contains("\"Sq Ft\" TEXT").contains("\"Group\" TEXT");
    }

    @Test
    void testEmptyCorpusProducesNoStatements() {
        TableGraph graph = new TableSplitter(merger, new ColumnTypeResolver(TypeInferencePolicy.TEXT_DEFAULT))
                .split(AggregateSchema.empty(), "Listings");

        assertThat(generator.generate(graph)).isEmpty();
    }

    @Test
    void testCollisionFailsGeneration() {
        ColumnSchema column = ColumnSchema.builder()
                .name("a_b")
                .sourcePath(List.of("a_b"))
                .sqlType(SqlType.TEXT)
                .nullable(true)
                .kind(ColumnKind.VALUE)
                .observedTags(Map.of(TypeTag.STRING, 1L))
                .build();
        ColumnNameCollision collision = new ColumnNameCollision("T", List.of("a", "b"), List.of("a_b", "a__b", "T__a__b"));
        TableSchema table = TableSchema.builder()
                .name("T")
                .column(column)
                .collision(collision)
                .build();

        assertThatThrownBy(() -> generator.generate(TableGraph.of("T", List.of(table))))
                .isInstanceOf(ColumnNameCollisionException.class)
                .hasMessageContaining("Table T")
                .hasMessageContaining("a.b (tried a_b, a__b, T__a__b)");
    }

    @Test
    void testDdlIsStableAcrossDocumentOrder() {
        String a = "{\"Id\": \"A\", \"Price\": 1, \"Phones\": [{\"PhoneNumber\": \"555\"}]}";
        String b = "{\"Id\": \"B\", \"Beds\": 2, \"Phones\": []}";

        assertThat(generator.generate(graph(a, b))).isEqualTo(generator.generate(graph(b, a)));
    }
}
