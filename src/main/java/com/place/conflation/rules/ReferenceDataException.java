package com.place.conflation.rules;

/**
 * Thrown when curated reference data cannot be read or parsed.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
