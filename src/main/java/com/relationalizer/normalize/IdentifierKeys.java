package com.relationalizer.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Recognizes identifier-like keys and ranks them for identity and primary key selection.
 */
public final class IdentifierKeys {

    public static final String GENERATED_ID_SUFFIX = "GeneratedId";

    private static final Pattern IDENTIFIER_PATTERN =
            Pattern.compile(".+" + GENERATED_ID_SUFFIX + "|[iI][dD]|.+[a-z]ID|.+Id");

    private static final int RANK_GENERATED = 0;
    private static final int RANK_EXACT_ID = 1;
    private static final int RANK_OTHER_ID = 2;
    private static final int RANK_NONE = Integer.MAX_VALUE;

    private IdentifierKeys() {
        // Utility class
    }

    public static String generatedIdKey(String owner) {
        return owner + GENERATED_ID_SUFFIX;
    }

    public static boolean isGeneratedId(String name) {
        return name.length() > GENERATED_ID_SUFFIX.length() && name.endsWith(GENERATED_ID_SUFFIX);
    }

    public static boolean isIdentifierLike(String name) {
        return IDENTIFIER_PATTERN.matcher(name).matches();
    }

    /**
     * Lower is better: generated ids, then {@code Id}, then other identifier-like names.
     */
    public static int rank(String name) {
        if (isGeneratedId(name)) {
            return RANK_GENERATED;
        }
        if (name.equalsIgnoreCase("id")) {
            return RANK_EXACT_ID;
        }
        return isIdentifierLike(name) ? RANK_OTHER_ID : RANK_NONE;
    }

    /**
     * Whether {@code name} identifies the row object itself rather than something it refers to.
     * For rows of the list {@code owner} that is {@code Id}, {@code <owner>Id}, the singular
     * {@code <Owner minus s>Id} and the generated {@code <owner>GeneratedId}, in any case.
     * {@code PhoneTypeId} in a {@code Phones} row names a type, not the phone.
     */
    public static boolean isRowIdentity(String name, String owner) {
        if (name.equalsIgnoreCase("id") || name.equalsIgnoreCase(generatedIdKey(owner))) {
            return true;
        }
        for (String stem : stems(owner)) {
            if (name.equalsIgnoreCase(stem + "id")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Best-ranked row identity among {@code names}, ties broken by case-insensitive name order.
     */
    public static Optional<String> choose(Collection<String> names, String owner) {
        return names.stream()
                .filter(name -> isRowIdentity(name, owner))
                .min(Comparator.comparingInt((String name) -> rank(name)).thenComparing(String.CASE_INSENSITIVE_ORDER));
    }

    /**
     * A natural identity is a row identity key, other than a generated id, holding a non-null
     * scalar value.
     */
    public static boolean hasNaturalIdentity(ObjectNode object, String owner) {
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!isGeneratedId(field.getKey()) && isRowIdentity(field.getKey(), owner)
                    && isScalarValue(field.getValue())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Key whose value identifies the row formed by this object, if any.
     */
    public static Optional<String> identityKey(ObjectNode object, String owner) {
        List<String> candidates = new ArrayList<>();
        object.fields().forEachRemaining(field -> {
            if (isScalarValue(field.getValue())) {
                candidates.add(field.getKey());
            }
        });
        return choose(candidates, owner);
    }

    private static List<String> stems(String owner) {
        List<String> stems = new ArrayList<>();
        stems.add(owner);
        int length = owner.length();
        if (length > 3 && owner.endsWith("ies")) {
            stems.add(owner.substring(0, length - 3) + "y");
        }
        if (length > 2 && owner.endsWith("es")) {
            stems.add(owner.substring(0, length - 2));
        }
        if (length > 1 && owner.endsWith("s")) {
            stems.add(owner.substring(0, length - 1));
        }
        return stems;
    }

    private static boolean isScalarValue(JsonNode value) {
        return value != null && value.isValueNode() && !value.isNull();
    }
}
