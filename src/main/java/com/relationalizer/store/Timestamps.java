package com.relationalizer.store;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code last_updated} values written by the scraper.
 */
public final class Timestamps {
    private static final Logger log = LoggerFactory.getLogger(Timestamps.class);

    private static final List<Function<String, Instant>> FORMATS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> LocalDateTime.parse(value.replace(' ', 'T')).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC));

    private Timestamps() {
        // Utility class
    }

    /**
     * Accepts ISO instants, offset date-times, local date-times (space or {@code T} separated,
     * read as UTC) and plain dates (start of day UTC). Missing or unreadable values map to the
     * epoch.
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return Instant.EPOCH;
        }
        String value = text.trim();
        for (Function<String, Instant> format : FORMATS) {
            try {
                return format.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("'{}' rejected: {}", value, e.getMessage());
            }
        }
        log.warn("Unreadable timestamp '{}', using the epoch", value);
        return Instant.EPOCH;
    }
}
