package com.relationalizer.sql;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.normalize.DocumentPaths;
import com.relationalizer.pipeline.RelationalizerConfig;

/**
 * The {@code PriceHistory} table: one row per listing and date on which its price was seen to
 * change. Lives beside the discovered tables and is not part of the table graph.
 */
public class PriceHistory {
    private static final Logger log = LoggerFactory.getLogger(PriceHistory.class);

    public static final String TABLE = "PriceHistory";

    private final List<String> keyPath;
    private final List<String> pricePath;
    private final String keyColumn;

    public PriceHistory(RelationalizerConfig config) {
        this.keyPath = DocumentPaths.segments(config.getPriceHistoryKeyPath());
        this.pricePath = DocumentPaths.segments(config.getPricePath());
        this.keyColumn = keyPath.get(keyPath.size() - 1);
    }

    public String getKeyColumn() {
        return keyColumn;
    }

    public String ddl() {
        return "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.quote(TABLE) + " ("
                + SqlIdentifiers.quote(keyColumn) + " INTEGER, Price INTEGER NOT NULL, Date TEXT NOT NULL);";
    }

    /**
     * The price of the document as of its last update, if it has a key, a numeric price and a
     * known update time.
     */
    public Optional<PriceChange> observe(NormalizedDocument document) {
        JsonNode key = DocumentPaths.resolve(document.getRoot(), keyPath);
        if (!key.isValueNode() || key.isNull()) {
            log.debug("Document {} has no {}, price not tracked", document.getDocumentId(), keyColumn);
            return Optional.empty();
        }
        Optional<BigDecimal> price = DocumentPaths.number(DocumentPaths.resolve(document.getRoot(), pricePath));
        if (price.isEmpty()) {
            log.debug("Document {} has no numeric price, price not tracked", document.getDocumentId());
            return Optional.empty();
        }
        Instant lastUpdated = document.getLastUpdated();
        if (Instant.EPOCH.equals(lastUpdated)) {
            log.debug("Document {} has no update time, price not tracked", document.getDocumentId());
            return Optional.empty();
        }
        JsonNode priceNode = JsonNodeFactory.instance.numberNode(
                price.get().setScale(0, RoundingMode.HALF_UP).toBigInteger());
        String date = LocalDate.ofInstant(lastUpdated, ZoneOffset.UTC).toString();
        return Optional.of(new PriceChange(keyColumn, key, priceNode, date));
    }
}
