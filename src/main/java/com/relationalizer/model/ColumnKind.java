package com.relationalizer.model;

public enum ColumnKind {
    /** Scalar value copied from the document. */
    VALUE,
    /** Serialized keys of the child rows extracted from a list. */
    REFERENCE
}
