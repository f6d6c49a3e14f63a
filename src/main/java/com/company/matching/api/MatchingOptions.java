package com.company.matching.api;

import com.company.matching.classify.BelowThresholdPolicy;
import com.company.matching.classify.MatchingPolicy;

/**
 * Options for a company matching run.
 * Configures the classification policy, score thresholds and the oracle review cap.
 */
public class MatchingOptions {

    private static final double DEFAULT_HIGH_THRESHOLD = 95.0;
    private static final double DEFAULT_LOW_THRESHOLD = 0.0;
    private static final double THRESHOLDED_HIGH_THRESHOLD = 90.0;
    private static final double THRESHOLDED_LOW_THRESHOLD = 75.0;
    private static final int DEFAULT_ORACLE_MAX_REVIEWS = 10;

    private final MatchingPolicy policy;
    private final double highThreshold;
    private final double lowThreshold;
    private final BelowThresholdPolicy belowThresholdPolicy;
    private final int oracleMaxReviews;

    private MatchingOptions(Builder builder) {
        this.policy = builder.policy;
        this.highThreshold = builder.highThreshold;
        this.lowThreshold = builder.lowThreshold;
        this.belowThresholdPolicy = builder.belowThresholdPolicy;
        this.oracleMaxReviews = builder.oracleMaxReviews;
    }

    public MatchingPolicy getPolicy() {
        return policy;
    }

    public double getHighThreshold() {
        return highThreshold;
    }

    public double getLowThreshold() {
        return lowThreshold;
    }

    public BelowThresholdPolicy getBelowThresholdPolicy() {
        return belowThresholdPolicy;
    }

    public int getOracleMaxReviews() {
        return oracleMaxReviews;
    }

    /**
     * Creates default options: every candidate is sent for adjudication, at most 10 reviews per run.
     */
    public static MatchingOptions defaults() {
        return builder().build();
    }

    /**
     * Creates threshold-driven options (90 / 75), discarding candidates under the low threshold.
     */
    public static MatchingOptions thresholded() {
        return builder()
                .policy(MatchingPolicy.THRESHOLDED)
                .highThreshold(THRESHOLDED_HIGH_THRESHOLD)
                .lowThreshold(THRESHOLDED_LOW_THRESHOLD)
                .belowThresholdPolicy(BelowThresholdPolicy.DISCARD)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MatchingPolicy policy = MatchingPolicy.BLANKET_ADJUDICATE;
        private double highThreshold = DEFAULT_HIGH_THRESHOLD;
        private double lowThreshold = DEFAULT_LOW_THRESHOLD;
        private BelowThresholdPolicy belowThresholdPolicy = BelowThresholdPolicy.ADJUDICATE;
        private int oracleMaxReviews = DEFAULT_ORACLE_MAX_REVIEWS;

        public Builder policy(MatchingPolicy policy) {
            if (policy == null) {
                throw new IllegalArgumentException("policy is required");
            }
            this.policy = policy;
            return this;
        }

        public Builder highThreshold(double highThreshold) {
            validateThreshold(highThreshold, "highThreshold");
            this.highThreshold = highThreshold;
            return this;
        }

        public Builder lowThreshold(double lowThreshold) {
            validateThreshold(lowThreshold, "lowThreshold");
            this.lowThreshold = lowThreshold;
            return this;
        }

        public Builder belowThresholdPolicy(BelowThresholdPolicy belowThresholdPolicy) {
            if (belowThresholdPolicy == null) {
                throw new IllegalArgumentException("belowThresholdPolicy is required");
            }
            this.belowThresholdPolicy = belowThresholdPolicy;
            return this;
        }

        public Builder oracleMaxReviews(int oracleMaxReviews) {
            if (oracleMaxReviews < 0) {
                throw new IllegalArgumentException("oracleMaxReviews must not be negative");
            }
            this.oracleMaxReviews = oracleMaxReviews;
            return this;
        }

        public MatchingOptions build() {
            if (highThreshold < lowThreshold) {
                throw new IllegalArgumentException("highThreshold must be >= lowThreshold");
            }
            return new MatchingOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 100.0) {
                throw new IllegalArgumentException(name + " must be between 0 and 100");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingOptions{" +
                "policy=" + policy +
                ", highThreshold=" + highThreshold +
                ", lowThreshold=" + lowThreshold +
                ", belowThresholdPolicy=" + belowThresholdPolicy +
                ", oracleMaxReviews=" + oracleMaxReviews +
                '}';
    }
}
