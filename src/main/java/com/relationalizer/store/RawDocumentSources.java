package com.relationalizer.store;

import java.nio.file.Path;
import java.util.Locale;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Picks the source implementation for an input file by extension.
 */
public final class RawDocumentSources {

    private RawDocumentSources() {
        // Utility class
    }

    public static boolean isJsonLines(Path input) {
        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".jsonl") || name.endsWith(".ndjson") || name.endsWith(".json");
    }

    public static RawDocumentSource open(Path input, ObjectMapper mapper) {
        return isJsonLines(input)
                ? new JsonLinesRawDocumentSource(input, mapper)
                : new SqliteRawDocumentSource(input);
    }
}
