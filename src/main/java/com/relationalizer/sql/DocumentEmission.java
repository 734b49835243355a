package com.relationalizer.sql;

import java.time.Instant;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Every insert produced from one document, child tables first, and its observed price when price
 * history is tracked. Written as one unit.
 */
@Value
@AllArgsConstructor
public class DocumentEmission {
    String documentId;
    Instant lastUpdated;
    List<InsertStatement> statements;
    List<PriceChange> priceChanges;

    public DocumentEmission(String documentId, Instant lastUpdated, List<InsertStatement> statements) {
        this(documentId, lastUpdated, statements, List.of());
    }
}
