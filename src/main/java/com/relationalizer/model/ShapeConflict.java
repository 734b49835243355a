package com.relationalizer.model;

import java.util.Map;

import lombok.Value;

/**
 * A path that was observed with incompatible shapes across the corpus, e.g. object and string.
 */
@Value
public class ShapeConflict {
    String path;
    Map<TypeTag, Long> counts;
}
