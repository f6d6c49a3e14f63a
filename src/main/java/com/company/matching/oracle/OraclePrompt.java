package com.company.matching.oracle;

import java.util.Objects;

/**
 * System instruction and user prompt sent to the decision oracle for one candidate pair.
 */
public record OraclePrompt(String systemPrompt, String userPrompt) {
    public OraclePrompt {
        Objects.requireNonNull(systemPrompt, "systemPrompt is required");
        Objects.requireNonNull(userPrompt, "userPrompt is required");
    }
}
