package com.company.matching.core.model;

/**
 * Buckets every web mention ends up in after a pipeline run.
 */
public enum MatchBucket {
    AUTO_ACCEPTED,
    ORACLE_ACCEPTED,
    STILL_AMBIGUOUS,
    DISCARDED,
    UNMATCHED
}
