package com.relationalizer.model;

import java.time.Instant;

import lombok.NonNull;
import lombok.Value;

/**
 * A listing as stored by the scraper: identifier, JSON body and last update time.
 */
@Value
public class RawDocument {
    @NonNull String id;
    @NonNull String json;
    @NonNull Instant lastUpdated;
}
