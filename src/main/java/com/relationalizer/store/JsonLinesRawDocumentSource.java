package com.relationalizer.store;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relationalizer.exception.DocumentStoreException;
import com.relationalizer.model.RawDocument;

/**
 * Reads one document per line. The document id is its {@code Id} field when present, otherwise
 * {@code <file>:<line>}; the last update time is the file's modification time.
 */
public class JsonLinesRawDocumentSource implements RawDocumentSource {

    private static final String ID_FIELD = "Id";

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesRawDocumentSource(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public String getName() {
        return file.getFileName().toString();
    }

    @Override
    public Stream<RawDocument> documents() {
        try {
            Instant modified = Files.getLastModifiedTime(file).toInstant();
            BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
            AtomicLong lineNumber = new AtomicLong();
            return reader.lines()
                    .map(text -> new Line(lineNumber.incrementAndGet(), text))
                    .filter(line -> !line.text().isBlank())
                    .map(line -> new RawDocument(idOf(line), line.text(), modified))
                    .onClose(() -> close(reader));
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to read " + file, e);
        }
    }

    /**
     * Scans the top level of the line for {@code Id} without building a tree, skipping nested
     * values. The body is parsed in full only once, by the normalizer.
     */
    private String idOf(Line line) {
        String fallback = getName() + ":" + line.number();
        try (JsonParser parser = mapper.getFactory().createParser(line.text())) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return fallback;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String field = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if (ID_FIELD.equals(field)) {
                    return value.isScalarValue() && value != JsonToken.VALUE_NULL ? parser.getText() : fallback;
                }
                parser.skipChildren();
            }
            return fallback;
        } catch (IOException e) {
            // the normalizer reports the malformed body under the fallback id
            return fallback;
        }
    }

    private void close(BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to close " + file, e);
        }
    }

    private record Line(long number, String text) {
    }
}
