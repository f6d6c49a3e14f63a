package com.company.matching.core.model;

/**
 * Provenance tag carried by a {@link MatchCandidate} and persisted as the match method.
 */
public enum MatchMethod {
    /**
     * Best-scoring candidate produced by the matcher, not yet classified.
     */
    FUZZY_NAME("fuzzy_name"),

    /**
     * Score at or above the high-confidence threshold; accepted without review.
     */
    FUZZY_NAME_HIGH_CONFIDENCE("fuzzy_name_high_conf"),

    /**
     * Needs adjudication by the decision oracle.
     */
    FUZZY_NAME_AMBIGUOUS("fuzzy_name_ambiguous"),

    /**
     * Accepted by the decision oracle.
     */
    ORACLE_ASSISTED("oracle_assisted");

    private final String code;

    MatchMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
