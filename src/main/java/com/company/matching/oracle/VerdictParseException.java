package com.company.matching.oracle;

/**
 * Thrown when an oracle response does not match the verdict schema.
 */
public class VerdictParseException extends RuntimeException {

    public VerdictParseException(String message) {
        super(message);
    }

    public VerdictParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
