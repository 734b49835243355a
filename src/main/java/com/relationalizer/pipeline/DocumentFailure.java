package com.relationalizer.pipeline;

import lombok.Value;

/**
 * A document that was skipped, and why.
 */
@Value
public class DocumentFailure {
    String documentId;
    Stage stage;
    String message;

    public enum Stage {
        /** The body could not be parsed into a document tree. */
        NORMALIZE,
        /** A row of the document did not satisfy the table schema. */
        EMIT
    }
}
