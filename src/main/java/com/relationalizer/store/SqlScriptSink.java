package com.relationalizer.store;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.relationalizer.exception.DocumentStoreException;
import com.relationalizer.sql.DocumentEmission;
import com.relationalizer.sql.InsertStatement;
import com.relationalizer.sql.PriceChange;
import com.relationalizer.util.FileWriteUtil;

/**
 * Writes a replayable SQL script, each document wrapped in its own transaction.
 */
public class SqlScriptSink implements SqlSink {

    private final Writer writer;
    private final boolean ownsWriter;

    /**
     * Writes to the given writer; closing the sink only flushes it.
     */
    public SqlScriptSink(Writer writer) {
        this.writer = writer;
        this.ownsWriter = false;
    }

    public SqlScriptSink(Path script) {
        try {
            FileWriteUtil.createParentDirectories(script);
            this.writer = Files.newBufferedWriter(script, StandardCharsets.UTF_8);
            this.ownsWriter = true;
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to open script " + script, e);
        }
    }

    @Override
    public void createTables(List<String> ddl) {
        for (String statement : ddl) {
            writeLine(statement);
        }
    }

    @Override
    public Optional<Instant> latestIngested() {
        return Optional.empty();
    }

    @Override
    public void write(DocumentEmission emission) {
        writeLine("-- document " + emission.getDocumentId());
        writeLine("BEGIN;");
        for (InsertStatement insert : emission.getStatements()) {
            writeLine(insert.toSql());
        }
        for (PriceChange change : emission.getPriceChanges()) {
            writeLine(change.toSql());
        }
        writeLine("COMMIT;");
    }

    @Override
    public void advanceWatermark(Instant lastUpdated) {
        // a script has no watermark; replaying it is idempotent
    }

    @Override
    public void close() {
        try {
            if (ownsWriter) {
                writer.close();
            } else {
                writer.flush();
            }
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to close SQL script", e);
        }
    }

    private void writeLine(String line) {
        try {
            writer.write(line);
            writer.write(System.lineSeparator());
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to write SQL script", e);
        }
    }
}
