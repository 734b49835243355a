package com.relationalizer.normalize;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Calculates the generated identity of an object from its content. Two objects with the same
 * key/value pairs, in any key order, get the same id in every run.
 */
public class ContentHasher {

    private static final HashFunction FINGERPRINT = Hashing.farmHashFingerprint64();

    private final ObjectMapper mapper;

    public ContentHasher(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Hash of every field except {@code excludedKey}.
     */
    public long hash(ObjectNode object, String excludedKey) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        object.fields().forEachRemaining(field -> {
            if (!field.getKey().equals(excludedKey)) {
                content.set(field.getKey(), field.getValue());
            }
        });
        return fingerprint(content);
    }

    /**
     * Hash of the listed fields only. Missing fields are left out.
     */
    public long hash(ObjectNode object, Collection<String> fields) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        for (String field : fields) {
            JsonNode value = object.get(field);
            if (value != null) {
                content.set(field, value);
            }
        }
        return fingerprint(content);
    }

    /**
     * Canonical JSON text: object keys sorted at every depth, list order kept.
     */
    public String canonicalJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(canonicalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize canonical form", e);
        }
    }

    private long fingerprint(ObjectNode content) {
        long hash = FINGERPRINT.hashString(canonicalJson(content), StandardCharsets.UTF_8).asLong();
        return hash & Long.MAX_VALUE;
    }

    private static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            keys.sort(null);
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            for (String key : keys) {
                sorted.set(key, canonicalize(node.get(key)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode copy = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                copy.add(canonicalize(element));
            }
            return copy;
        }
        return node;
    }
}
