package com.company.matching.audit;

import java.util.Objects;

/**
 * One oracle interaction: the prompt sent and the raw response received.
 */
public record OracleAuditEntry(String prompt, String response) {
    public OracleAuditEntry {
        Objects.requireNonNull(prompt, "prompt is required");
        Objects.requireNonNull(response, "response is required");
    }
}
