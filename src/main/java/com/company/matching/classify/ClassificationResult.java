package com.company.matching.classify;

import com.company.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * Candidates partitioned into confidence tiers. Each list preserves input order.
 */
public record ClassificationResult(
        List<MatchCandidate> autoAccept,
        List<MatchCandidate> needsAdjudication,
        List<MatchCandidate> discarded
) {
    public ClassificationResult {
        autoAccept = autoAccept != null ? List.copyOf(autoAccept) : List.of();
        needsAdjudication = needsAdjudication != null ? List.copyOf(needsAdjudication) : List.of();
        discarded = discarded != null ? List.copyOf(discarded) : List.of();
    }

    public int total() {
        return autoAccept.size() + needsAdjudication.size() + discarded.size();
    }
}
