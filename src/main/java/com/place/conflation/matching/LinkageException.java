package com.place.conflation.matching;

/**
 * Thrown when the linkage run itself cannot complete, e.g. when the scoring
 * workers are interrupted. Bad input records never raise this exception.
 */
public class LinkageException extends RuntimeException {

    public LinkageException(String message, Throwable cause) {
        super(message, cause);
    }
}
