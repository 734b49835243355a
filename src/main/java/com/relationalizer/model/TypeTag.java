package com.relationalizer.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Closed set of JSON value kinds observed while profiling documents.
 */
public enum TypeTag {
    STRING("str"),
    INTEGER("int"),
    FLOAT("float"),
    BOOLEAN("bool"),
    NULL("null"),
    OBJECT("dict"),
    LIST("list");

    private final String label;

    TypeTag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isContainer() {
        return this == OBJECT || this == LIST;
    }

    /**
     * True for tags that carry a value a column can store.
     */
    public boolean isScalarValue() {
        return !isContainer() && this != NULL;
    }

    public static TypeTag of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NULL;
        }
        if (node.isObject()) {
            return OBJECT;
        }
        if (node.isArray()) {
            return LIST;
        }
        if (node.isBoolean()) {
            return BOOLEAN;
        }
        if (node.isIntegralNumber()) {
            return INTEGER;
        }
        if (node.isNumber()) {
            return FLOAT;
        }
        return STRING;
    }
}
