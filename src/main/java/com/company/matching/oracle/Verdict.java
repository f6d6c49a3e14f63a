package com.company.matching.oracle;

import java.util.Objects;

/**
 * Structured decision returned by the oracle for one candidate pair.
 */
public record Verdict(boolean isMatch, Confidence confidence, String reason) {
    public Verdict {
        Objects.requireNonNull(confidence, "confidence is required");
        Objects.requireNonNull(reason, "reason is required");
    }

    /**
     * A pair is accepted only for a positive match reported with medium or high confidence.
     * A low-confidence match stays ambiguous.
     */
    public boolean isAcceptable() {
        return isMatch && confidence.isAtLeast(Confidence.MEDIUM);
    }
}
