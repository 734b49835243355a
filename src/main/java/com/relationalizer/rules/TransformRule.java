package com.relationalizer.rules;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * A single rule from the transformation rules file.
 */
@Data
@Builder
public class TransformRule {
    private String target;
    private Effect effect;
    private String argument;
    private List<String> fields;
    private int lineNumber;

    public enum Effect {
        /**
         * Remove the key (noise key).
         */
        DROP,

        /**
         * Replace a list by its first element, or null when the list is empty.
         */
        FIRST,

        /**
         * Wrap a non-list value in a single-element list so that it becomes a table.
         */
        WRAP_LIST,

        /**
         * Collapse a list of objects into the delimited values of one field.
         */
        JOIN,

        /**
         * Force generated identities on the list members at this path.
         */
        GENERATE_ID,

        /**
         * Strip non-digit characters from a string and store it as an integer.
         */
        DIGITS,

        /**
         * Reparse a date/time string with a pattern and store it as ISO-8601.
         */
        DATE,

        /**
         * Keep this path's column in minimal mode.
         */
        MINIMAL
    }

    /**
     * Path targets start with {@code $}; anything else is a bare key matched at any depth.
     */
    public boolean isPathTarget() {
        return target != null && target.startsWith("$");
    }

    public boolean matches(String key, String path) {
        return isPathTarget() ? target.equals(path) : target.equals(key);
    }
}
