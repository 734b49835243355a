package com.relationalizer.exception;

/**
 * Base type for every failure raised by the relationalizer core.
 */
public class RelationalizerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RelationalizerException(String message) {
        super(message);
    }

    public RelationalizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
