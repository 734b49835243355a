package com.relationalizer.store;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.relationalizer.sql.DocumentEmission;

/**
 * Destination of generated DDL and per-document inserts.
 */
public interface SqlSink extends AutoCloseable {

    void createTables(List<String> ddl);

    /**
     * Newest {@code lastUpdated} of the documents already written, if the sink tracks it.
     */
    Optional<Instant> latestIngested();

    /**
     * Writes all statements of one document atomically.
     */
    void write(DocumentEmission emission);

    /**
     * Records that every document up to {@code lastUpdated} has been written. Called once, after
     * a run wrote all of its documents, so an aborted run never moves the watermark past a
     * document it did not write. Never moves the watermark backwards.
     */
    void advanceWatermark(Instant lastUpdated);

    @Override
    void close();
}
