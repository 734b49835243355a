package com.relationalizer.model;

import java.time.Instant;

import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.NonNull;
import lombok.Value;

/**
 * Canonical tree of one raw document. The tree is freshly built by the normalizer and is not
 * modified afterwards.
 */
@Value
public class NormalizedDocument {
    @NonNull String documentId;
    @NonNull ObjectNode root;
    @NonNull Instant lastUpdated;
}
