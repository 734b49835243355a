package com.relationalizer.sql;

/**
 * How column types are derived from observed type tags.
 */
public enum TypeInferencePolicy {
    /**
     * Integer identifier columns and generated ids are INTEGER, everything else TEXT.
     */
    TEXT_DEFAULT,

    /**
     * Consistent integer, float and boolean observations map to INTEGER or REAL; any mix falls
     * back to TEXT.
     */
    AUTOMATIC
}
