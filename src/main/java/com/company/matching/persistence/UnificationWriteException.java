package com.company.matching.persistence;

/**
 * Thrown when writing unified companies fails. The transaction has already been rolled back
 * when this is raised; no partial run is committed.
 */
public class UnificationWriteException extends RuntimeException {

    public UnificationWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
