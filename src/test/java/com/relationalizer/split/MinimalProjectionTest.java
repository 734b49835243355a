package com.relationalizer.split;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.ColumnSchema;
import com.relationalizer.model.RawDocument;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TableSchema;
import com.relationalizer.normalize.ComputedColumns;
import com.relationalizer.normalize.DocumentNormalizer;
import com.relationalizer.pipeline.RelationalizerConfig;
import com.relationalizer.profile.SchemaMerger;
import com.relationalizer.profile.TypeProfiler;
import com.relationalizer.rules.TransformRuleParser;
import com.relationalizer.rules.TransformRules;
import com.relationalizer.sql.ColumnTypeResolver;
import com.relationalizer.sql.TypeInferencePolicy;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MinimalProjection.
 */
class MinimalProjectionTest {

    private final SchemaMerger merger = new SchemaMerger();

    private TableGraph graph(String document) {
        return graph(RelationalizerConfig.defaults(), document);
    }

    private TableGraph graph(RelationalizerConfig config, String document) {
        DocumentNormalizer normalizer = new DocumentNormalizer(config, new ObjectMapper());
        AggregateSchema schema = merger.aggregate(Stream.of(document)
                .map(json -> normalizer.normalize(new RawDocument("doc", json, Instant.EPOCH)))
                .map(new TypeProfiler(merger)::profile));
        return new TableSplitter(merger, new ColumnTypeResolver(TypeInferencePolicy.TEXT_DEFAULT))
                .split(schema, "Listings");
    }

    @Test
    void testKeepsRootWithMarkedColumnsAndPrimaryKey() {
        TableGraph full = graph("""
                {"Id": "A", "Price": 10, "Property": {"Address": {"City": "Austin"}}, "Phones": [{"Number": "1"}]}
                """);
        TransformRules rules = new TransformRuleParser().parse(List.of(
                "$.Property.Address.City = MINIMAL",
                "$.Phones = MINIMAL"));

        TableGraph minimal = new MinimalProjection(rules).apply(full);

        assertThat(minimal.isProjection()).isTrue();
        assertThat(minimal.getTables()).extracting(TableSchema::getName).containsExactly("Listings");
        TableSchema root = minimal.getRoot().orElseThrow();
        assertThat(root.getColumns()).extracting(ColumnSchema::getName)
                .containsExactly("Id", "Phones", "Property_Address_City");
        assertThat(root.columnNamed("Phones").orElseThrow().getReferencedTable()).isNull();
        assertThat(root.referencedTables()).isEmpty();
    }

    @Test
    void testWithoutMinimalRulesOnlyPrimaryKeyRemains() {
        TableGraph full = graph("{\"Id\": \"A\", \"Price\": 10}");

        TableGraph minimal = new MinimalProjection(TransformRules.empty()).apply(full);

        assertThat(minimal.getRoot().orElseThrow().getColumns()).extracting(ColumnSchema::getName)
                .containsExactly("Id");
    }

    @Test
    void testComputedColumnsAreKept() {
        RelationalizerConfig config = RelationalizerConfig.builder().computedColumns(true).build();
        TableGraph full = graph(config, """
                {"Id": "A", "Building": {"SizeInterior": "900 sqft"}, "Property": {"PriceUnformattedValue": 90000}}
                """);

        TableGraph minimal = new MinimalProjection(TransformRules.empty()).apply(full);

        assertThat(minimal.getRoot().orElseThrow().getColumns()).extracting(ColumnSchema::getName)
                .containsExactlyInAnyOrder(ComputedColumns.LAST_UPDATED, ComputedColumns.NEW_BUILD,
                        ComputedColumns.PRICE_PER_SQFT, ComputedColumns.SQFT, "Id");
    }
}
