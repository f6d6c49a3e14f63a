package com.company.matching.audit;

/**
 * Append-only record of oracle interactions, in execution order.
 */
public interface OracleAuditLog {

    /**
     * Appends an entry.
     *
     * @throws AuditLogException if the entry could not be written
     */
    void append(OracleAuditEntry entry);
}
