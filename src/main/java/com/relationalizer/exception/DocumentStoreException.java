package com.relationalizer.exception;

/**
 * Raised when a raw document store or an output database cannot be read or written.
 */
public class DocumentStoreException extends RelationalizerException {

    private static final long serialVersionUID = 1L;

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
