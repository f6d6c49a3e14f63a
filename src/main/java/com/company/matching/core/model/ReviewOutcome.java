package com.company.matching.core.model;

/**
 * Outcome of a single oracle review.
 */
public enum ReviewOutcome {
    ACCEPTED,
    REJECTED,
    FAILED
}
