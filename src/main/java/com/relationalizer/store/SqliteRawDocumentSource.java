package com.relationalizer.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.relationalizer.exception.DocumentStoreException;
import com.relationalizer.model.RawDocument;

/**
 * Reads raw documents from the scraper's SQLite database:
 * {@code listings(id INTEGER PRIMARY KEY, details TEXT NOT NULL, last_updated TEXT NOT NULL)}.
 */
public class SqliteRawDocumentSource implements RawDocumentSource {
    private static final Logger log = LoggerFactory.getLogger(SqliteRawDocumentSource.class);

    public static final String DEFAULT_TABLE = "listings";

    private final Path database;
    private final String table;

    public SqliteRawDocumentSource(Path database) {
        this(database, DEFAULT_TABLE);
    }

    public SqliteRawDocumentSource(Path database, String table) {
        this.database = database;
        this.table = table;
    }

    @Override
    public String getName() {
        return database.getFileName().toString();
    }

    @Override
    public Stream<RawDocument> documents() {
        Connection connection = null;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + database.toAbsolutePath());
            PreparedStatement statement = connection.prepareStatement(
                    "SELECT id, details, last_updated FROM " + table + " ORDER BY id");
            ResultSet rows = statement.executeQuery();
            Connection open = connection;
            log.debug("Reading raw documents from {}", database);
            return StreamSupport.stream(new RowSpliterator(rows), false)
                    .onClose(() -> close(open));
        } catch (SQLException e) {
            if (connection != null) {
                close(connection);
            }
            throw new DocumentStoreException("Failed to read raw documents from " + database, e);
        }
    }

    private void close(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new DocumentStoreException("Failed to close " + database, e);
        }
    }

    private final class RowSpliterator extends Spliterators.AbstractSpliterator<RawDocument> {
        private final ResultSet rows;

        RowSpliterator(ResultSet rows) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.rows = rows;
        }

        @Override
        public boolean tryAdvance(Consumer<? super RawDocument> action) {
            try {
                if (!rows.next()) {
                    return false;
                }
                String details = rows.getString(2);
                action.accept(new RawDocument(rows.getString(1), details == null ? "" : details,
                        Timestamps.parse(rows.getString(3))));
                return true;
            } catch (SQLException e) {
                throw new DocumentStoreException("Failed to read raw documents from " + database, e);
            }
        }
    }
}
