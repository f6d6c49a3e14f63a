package com.company.matching.classify;

/**
 * How the tier classifier treats candidate scores.
 */
public enum MatchingPolicy {
    /**
     * Scores are compared with the high and low thresholds.
     */
    THRESHOLDED,

    /**
     * Thresholds are ignored and every candidate goes to the decision oracle.
     */
    BLANKET_ADJUDICATE
}
