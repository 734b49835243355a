package com.relationalizer.exception;

/**
 * Raised when a raw document body is not valid JSON or its root is not an object.
 * The pipeline reports the document and moves on.
 */
public class MalformedDocumentException extends RelationalizerException {

    private static final long serialVersionUID = 1L;
    private final String documentId;

    public MalformedDocumentException(String documentId, String message) {
        super("Document " + documentId + ": " + message);
        this.documentId = documentId;
    }

    public MalformedDocumentException(String documentId, String message, Throwable cause) {
        super("Document " + documentId + ": " + message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
