package com.rigwatch.core.processor;

/**
 * An event was rejected at the ingestion boundary and was not stored.
 */
public class InvalidEventException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidEventException(String message) {
        super(message);
    }
}
