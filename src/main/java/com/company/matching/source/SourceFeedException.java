package com.company.matching.source;

/**
 * Thrown when source records cannot be loaded.
 */
public class SourceFeedException extends RuntimeException {

    public SourceFeedException(String message) {
        super(message);
    }

    public SourceFeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
