package com.relationalizer.store;

import java.math.BigInteger;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.relationalizer.exception.DocumentStoreException;
import com.relationalizer.sql.DocumentEmission;
import com.relationalizer.sql.InsertStatement;
import com.relationalizer.sql.PriceChange;

/**
 * Writes to a SQLite database over one JDBC connection, one transaction per document. The
 * {@code IngestWatermark} table remembers the newest document of the last completed run.
 */
public class SqliteSqlSink implements SqlSink {
    private static final Logger log = LoggerFactory.getLogger(SqliteSqlSink.class);

    static final String WATERMARK_TABLE = "IngestWatermark";

    private static final String CREATE_WATERMARK = "CREATE TABLE IF NOT EXISTS " + WATERMARK_TABLE
            + " (Id INTEGER PRIMARY KEY, LastUpdatedEpochMillis INTEGER NOT NULL)";
    private static final String SELECT_WATERMARK = "SELECT LastUpdatedEpochMillis FROM " + WATERMARK_TABLE
            + " WHERE Id = 1";
    private static final String ADVANCE_WATERMARK = "INSERT INTO " + WATERMARK_TABLE
            + " (Id, LastUpdatedEpochMillis) VALUES (1, ?) ON CONFLICT(Id) DO UPDATE SET"
            + " LastUpdatedEpochMillis = MAX(LastUpdatedEpochMillis, excluded.LastUpdatedEpochMillis)";

    private final Path database;
    private final Connection connection;

    public SqliteSqlSink(Path database) {
        this.database = database;
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute(CREATE_WATERMARK);
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Failed to open output database " + database, e);
        }
    }

    @Override
    public void createTables(List<String> ddl) {
        inTransaction("create tables", () -> {
            try (Statement statement = connection.createStatement()) {
                for (String sql : ddl) {
                    statement.execute(sql);
                }
            }
        });
        log.info("Created {} tables in {}", ddl.size(), database);
    }

    @Override
    public Optional<Instant> latestIngested() {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(SELECT_WATERMARK)) {
            return rs.next() ? Optional.of(Instant.ofEpochMilli(rs.getLong(1))) : Optional.empty();
        } catch (SQLException e) {
            throw new DocumentStoreException("Failed to read the ingest watermark of " + database, e);
        }
    }

    @Override
    public void write(DocumentEmission emission) {
        inTransaction("write document " + emission.getDocumentId(), () -> {
            for (InsertStatement insert : emission.getStatements()) {
                try (PreparedStatement statement = connection.prepareStatement(insert.toParameterizedSql())) {
                    List<JsonNode> values = insert.getValues();
                    for (int i = 0; i < values.size(); i++) {
                        bind(statement, i + 1, values.get(i));
                    }
                    statement.executeUpdate();
                }
            }
            for (PriceChange change : emission.getPriceChanges()) {
                try (PreparedStatement statement = connection.prepareStatement(change.toParameterizedSql())) {
                    List<JsonNode> parameters = change.getParameters();
                    for (int i = 0; i < parameters.size(); i++) {
                        bind(statement, i + 1, parameters.get(i));
                    }
                    statement.executeUpdate();
                }
            }
        });
    }

    @Override
    public void advanceWatermark(Instant lastUpdated) {
        inTransaction("advance the ingest watermark", () -> {
            try (PreparedStatement statement = connection.prepareStatement(ADVANCE_WATERMARK)) {
                statement.setLong(1, lastUpdated.toEpochMilli());
                statement.executeUpdate();
            }
        });
        log.debug("Ingest watermark of {} advanced to {}", database, lastUpdated);
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DocumentStoreException("Failed to close output database " + database, e);
        }
    }

    private void inTransaction(String action, SqlWork work) {
        try {
            connection.setAutoCommit(false);
            try {
                work.run();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Failed to " + action + " in " + database, e);
        }
    }

    private static void bind(PreparedStatement statement, int index, JsonNode value) throws SQLException {
        if (value == null || value.isNull()) {
            statement.setObject(index, null);
        } else if (value.isBoolean()) {
            statement.setInt(index, value.booleanValue() ? 1 : 0);
        } else if (value.isIntegralNumber()) {
            BigInteger number = value.bigIntegerValue();
            if (number.bitLength() < Long.SIZE) {
                statement.setLong(index, number.longValue());
            } else {
                statement.setString(index, number.toString());
            }
        } else if (value.isNumber()) {
            statement.setDouble(index, value.doubleValue());
        } else if (value.isTextual()) {
            statement.setString(index, value.textValue());
        } else {
            statement.setString(index, value.toString());
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }
}
