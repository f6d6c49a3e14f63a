package com.company.matching.classify;

import com.company.matching.api.MatchingOptions;
import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.MatchMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Partitions matcher output into auto-accept, needs-adjudication and discarded tiers.
 * Deterministic for a given input order; candidates are re-tagged, never mutated.
 */
public class TierClassifier {
    private static final Logger log = LoggerFactory.getLogger(TierClassifier.class);

    private final MatchingPolicy policy;
    private final double highThreshold;
    private final double lowThreshold;
    private final BelowThresholdPolicy belowThresholdPolicy;

    public TierClassifier(MatchingOptions options) {
        this(options.getPolicy(), options.getHighThreshold(), options.getLowThreshold(),
                options.getBelowThresholdPolicy());
    }

    public TierClassifier(MatchingPolicy policy, double highThreshold, double lowThreshold,
                          BelowThresholdPolicy belowThresholdPolicy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.belowThresholdPolicy = Objects.requireNonNull(belowThresholdPolicy, "belowThresholdPolicy is required");
        if (highThreshold < lowThreshold) {
            throw new IllegalArgumentException("highThreshold must be >= lowThreshold");
        }
        this.highThreshold = highThreshold;
        this.lowThreshold = lowThreshold;
    }

    public ClassificationResult classify(List<MatchCandidate> candidates) {
        Objects.requireNonNull(candidates, "candidates is required");

        List<MatchCandidate> autoAccept = new ArrayList<>();
        List<MatchCandidate> needsAdjudication = new ArrayList<>();
        List<MatchCandidate> discarded = new ArrayList<>();

        for (MatchCandidate candidate : candidates) {
            if (policy == MatchingPolicy.BLANKET_ADJUDICATE) {
                needsAdjudication.add(candidate.withMethod(MatchMethod.FUZZY_NAME_AMBIGUOUS));
            } else if (candidate.score() >= highThreshold) {
                autoAccept.add(candidate.withMethod(MatchMethod.FUZZY_NAME_HIGH_CONFIDENCE));
            } else if (candidate.score() >= lowThreshold
                    || belowThresholdPolicy == BelowThresholdPolicy.ADJUDICATE) {
                needsAdjudication.add(candidate.withMethod(MatchMethod.FUZZY_NAME_AMBIGUOUS));
            } else {
                discarded.add(candidate);
            }
        }

        log.info("classification.completed policy={} high={} low={} autoAccept={} needsAdjudication={} discarded={}",
                policy, highThreshold, lowThreshold, autoAccept.size(), needsAdjudication.size(), discarded.size());
        return new ClassificationResult(autoAccept, needsAdjudication, discarded);
    }

    public MatchingPolicy getPolicy() {
        return policy;
    }
}
