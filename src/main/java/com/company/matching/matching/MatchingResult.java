package com.company.matching.matching;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.WebMention;

import java.util.List;

/**
 * Output of the candidate matcher.
 *
 * @param candidates one best candidate per matchable web mention, in input order
 * @param unmatched  web mentions with an empty name or no eligible registry entity, in input order
 */
public record MatchingResult(List<MatchCandidate> candidates, List<WebMention> unmatched) {
    public MatchingResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        unmatched = unmatched != null ? List.copyOf(unmatched) : List.of();
    }

    public static MatchingResult empty() {
        return new MatchingResult(List.of(), List.of());
    }
}
