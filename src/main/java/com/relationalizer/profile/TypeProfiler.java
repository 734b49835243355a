package com.relationalizer.profile;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.relationalizer.model.NormalizedDocument;
import com.relationalizer.model.TypeProfile;
import com.relationalizer.model.TypeTag;

/**
 * Records the type of every value of a normalized document in a tree shaped like the document.
 */
public class TypeProfiler {

    private final SchemaMerger merger;

    public TypeProfiler(SchemaMerger merger) {
        this.merger = merger;
    }

    public TypeProfile profile(NormalizedDocument document) {
        return profile(document.getRoot());
    }

    public TypeProfile profile(JsonNode node) {
        TypeTag tag = TypeTag.of(node);
        return switch (tag) {
            case OBJECT -> profileObject(node);
            case LIST -> profileList(node);
            default -> TypeProfile.leaf(tag);
        };
    }

    private TypeProfile profileObject(JsonNode node) {
        Map<String, TypeProfile> fields = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), profile(field.getValue()));
        }
        return TypeProfile.object(fields);
    }

    /**
     * Members of a list are instances of one schema, so their profiles are merged.
     */
    private TypeProfile profileList(JsonNode node) {
        if (node.isEmpty()) {
            return TypeProfile.list(null);
        }
        TypeProfile element = TypeProfile.empty();
        for (JsonNode member : node) {
            element = merger.merge(element, profile(member));
        }
        return TypeProfile.list(element);
    }
}
