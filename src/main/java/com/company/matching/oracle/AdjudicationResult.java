package com.company.matching.oracle;

import com.company.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * Outcome of an adjudication pass.
 *
 * @param accepted       candidates accepted by the oracle, re-tagged as oracle-assisted, in input order
 * @param stillAmbiguous rejected reviewed candidates followed by the deferred remainder, unmodified
 * @param reviewed       number of candidates sent to the oracle
 * @param failed         number of reviews that failed (call error or unparseable verdict)
 */
public record AdjudicationResult(
        List<MatchCandidate> accepted,
        List<MatchCandidate> stillAmbiguous,
        int reviewed,
        int failed
) {
    public AdjudicationResult {
        accepted = accepted != null ? List.copyOf(accepted) : List.of();
        stillAmbiguous = stillAmbiguous != null ? List.copyOf(stillAmbiguous) : List.of();
    }

    public static AdjudicationResult skipped(List<MatchCandidate> candidates) {
        return new AdjudicationResult(List.of(), candidates, 0, 0);
    }
}
