package com.relationalizer.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relationalizer.exception.MalformedDocumentException;
import com.relationalizer.exception.RelationalizerException;
import com.relationalizer.exception.RowValidationException;
import com.relationalizer.model.AggregateSchema;
import com.relationalizer.model.RawDocument;
import com.relationalizer.model.TableGraph;
import com.relationalizer.model.TypeProfile;
import com.relationalizer.normalize.DocumentNormalizer;
import com.relationalizer.pipeline.DocumentFailure.Stage;
import com.relationalizer.profile.SchemaMerger;
import com.relationalizer.profile.TypeProfiler;
import com.relationalizer.split.MinimalProjection;
import com.relationalizer.split.TableSplitter;
import com.relationalizer.sql.ColumnTypeResolver;
import com.relationalizer.sql.DdlGenerator;
import com.relationalizer.sql.DocumentEmission;
import com.relationalizer.sql.PriceHistory;
import com.relationalizer.sql.RowEmitter;
import com.relationalizer.store.RawDocumentSource;
import com.relationalizer.store.SqlSink;

/**
 * Drives both passes over the raw documents: schema discovery (normalize, profile, merge,
 * split, DDL) and population (normalize, split, insert).
 */
public class RelationalizerPipeline {
    private static final Logger log = LoggerFactory.getLogger(RelationalizerPipeline.class);

    private static final int BATCH_SIZE = 500;

    private final RelationalizerConfig config;
    private final ObjectMapper mapper;
    private final DocumentNormalizer normalizer;
    private final SchemaMerger merger;
    private final TypeProfiler profiler;
    private final TableSplitter splitter;
    private final DdlGenerator ddlGenerator;
    private final RowEmitter rowEmitter;

    public RelationalizerPipeline(RelationalizerConfig config) {
        this(config, new ObjectMapper());
    }

    public RelationalizerPipeline(RelationalizerConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
        this.normalizer = new DocumentNormalizer(config, mapper);
        this.merger = new SchemaMerger();
        this.profiler = new TypeProfiler(merger);
        this.splitter = new TableSplitter(merger, new ColumnTypeResolver(config.getTypePolicy()));
        this.ddlGenerator = new DdlGenerator();
        this.rowEmitter = new RowEmitter(config, normalizer, splitter, mapper);
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    /**
     * Discovers the table graph of all documents in the sources.
     *
     * @throws com.relationalizer.exception.ColumnNameCollisionException if a table cannot be given
     *         distinct column names
     */
    public SchemaAnalysis analyze(List<RawDocumentSource> sources) {
        log.info("Step 1: Profiling documents...");
        List<DocumentFailure> failures = Collections.synchronizedList(new ArrayList<>());
        AggregateSchema aggregate = AggregateSchema.empty();
        long read = 0;
        ForkJoinPool pool = config.getParallelism() > 1 ? new ForkJoinPool(config.getParallelism()) : null;
        try {
            for (RawDocumentSource source : sources) {
                log.info("Profiling {}", source.getName());
                try (Stream<RawDocument> documents = source.documents()) {
                    Iterator<RawDocument> it = documents.iterator();
                    while (it.hasNext()) {
                        List<RawDocument> batch = nextBatch(it);
                        aggregate = merger.merge(aggregate, profileBatch(batch, pool, failures));
                        read += batch.size();
                    }
                }
            }
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }
        log.info("Profiled {} of {} documents", aggregate.getDocumentCount(), read);

        log.info("Step 2: Deriving tables...");
        TableGraph graph = splitter.split(aggregate, config.getRootTableName());
        if (config.isMinimal()) {
            graph = new MinimalProjection(config.getRules()).apply(graph);
        }

        log.info("Step 3: Generating DDL...");
        List<String> ddl = new ArrayList<>(ddlGenerator.generate(graph));
        if (config.isPriceHistory()) {
            ddl.add(new PriceHistory(config).ddl());
        }

        List<DocumentFailure> rejected = new ArrayList<>(failures);
        if (config.getParallelism() > 1) {
            rejected.sort(Comparator.comparing(DocumentFailure::getDocumentId));
        }
        return SchemaAnalysis.builder()
                .aggregate(aggregate)
                .tableGraph(graph)
                .ddl(List.copyOf(ddl))
                .failures(List.copyOf(rejected))
                .documentsRead(read)
                .build();
    }

    /**
     * Discovers the schema, then writes every document's rows to the sink. Documents that fail
     * are reported in the result and do not stop the run.
     */
    public PipelineResult run(List<RawDocumentSource> sources, SqlSink sink) {
        try {
            SchemaAnalysis analysis = analyze(sources);
            TableGraph graph = analysis.getTableGraph();

            int tablesCreated = 0;
            if (config.isCreateTables()) {
                log.info("Step 4: Creating tables...");
                sink.createTables(analysis.getDdl());
                tablesCreated = analysis.getDdl().size();
            } else if (config.isPriceHistory()) {
                // the discovered tables already exist; PriceHistory may not
                sink.createTables(List.of(new PriceHistory(config).ddl()));
            }

            Optional<Instant> watermark = config.isIncremental() ? sink.latestIngested() : Optional.empty();
            watermark.ifPresent(w -> log.info("Skipping documents last updated at or before {}", w));

            log.info("Step 5: Writing rows...");
            Set<String> rejectedIds = analysis.getFailures().stream()
                    .map(DocumentFailure::getDocumentId)
                    .collect(Collectors.toSet());
            List<DocumentFailure> failures = new ArrayList<>(analysis.getFailures());
            long read = 0;
            long written = 0;
            long skipped = 0;
            long statements = 0;
            Instant newest = null;

            for (RawDocumentSource source : sources) {
                try (Stream<RawDocument> documents = source.documents()) {
                    Iterator<RawDocument> it = documents.iterator();
                    while (it.hasNext()) {
                        RawDocument raw = it.next();
                        read++;
                        if (watermark.isPresent() && !raw.getLastUpdated().isAfter(watermark.get())) {
                            skipped++;
                            continue;
                        }
                        try {
                            DocumentEmission emission = rowEmitter.emit(raw, graph);
                            sink.write(emission);
                            written++;
                            statements += emission.getStatements().size();
                            if (newest == null || raw.getLastUpdated().isAfter(newest)) {
                                newest = raw.getLastUpdated();
                            }
                        } catch (MalformedDocumentException e) {
                            if (!rejectedIds.contains(raw.getId())) {
                                log.warn("Skipping document: {}", e.getMessage());
                                failures.add(new DocumentFailure(raw.getId(), Stage.NORMALIZE, e.getMessage()));
                            }
                        } catch (RowValidationException e) {
                            log.warn("Skipping document: {}", e.getMessage());
                            failures.add(new DocumentFailure(raw.getId(), Stage.EMIT, e.getMessage()));
                        }
                    }
                }
            }

            if (newest != null) {
                sink.advanceWatermark(newest);
            }

            log.info("Relationalization complete!");
            return PipelineResult.builder()
                    .success(true)
                    .analysis(analysis)
                    .documentsRead(read)
                    .documentsWritten(written)
                    .documentsSkipped(skipped)
                    .statementsWritten(statements)
                    .tablesCreated(tablesCreated)
                    .failures(List.copyOf(failures))
                    .build();

        } catch (RelationalizerException e) {
            log.error("Relationalization failed", e);
            return PipelineResult.failure(e.getMessage());
        }
    }

    private static List<RawDocument> nextBatch(Iterator<RawDocument> it) {
        List<RawDocument> batch = new ArrayList<>(BATCH_SIZE);
        while (it.hasNext() && batch.size() < BATCH_SIZE) {
            batch.add(it.next());
        }
        return batch;
    }

    /**
     * Profiles a batch sequentially, or on the pool's parallel stream when one is given.
     */
    private AggregateSchema profileBatch(List<RawDocument> batch, ForkJoinPool pool, List<DocumentFailure> failures) {
        if (pool == null) {
            return merger.aggregate(batch.stream().map(raw -> profileOrReport(raw, failures)));
        }
        try {
            return pool.submit(() -> merger.aggregate(batch.parallelStream().map(raw -> profileOrReport(raw, failures))))
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelationalizerException("Interrupted while profiling documents", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RelationalizerException("Profiling failed", e.getCause());
        }
    }

    private TypeProfile profileOrReport(RawDocument raw, List<DocumentFailure> failures) {
        try {
            return profiler.profile(normalizer.normalize(raw));
        } catch (MalformedDocumentException e) {
            log.warn("Skipping document: {}", e.getMessage());
            failures.add(new DocumentFailure(raw.getId(), Stage.NORMALIZE, e.getMessage()));
            return TypeProfile.empty();
        }
    }
}
