package com.company.matching.classify;

/**
 * What happens to candidates scoring under the low threshold in {@link MatchingPolicy#THRESHOLDED} mode.
 */
public enum BelowThresholdPolicy {
    /**
     * Fold them into the needs-adjudication bucket.
     */
    ADJUDICATE,

    /**
     * Drop them from further processing.
     */
    DISCARD
}
