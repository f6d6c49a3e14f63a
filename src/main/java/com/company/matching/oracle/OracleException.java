package com.company.matching.oracle;

/**
 * Thrown when a call to the decision oracle fails: transport error, non-success
 * status or an unreadable response envelope.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
