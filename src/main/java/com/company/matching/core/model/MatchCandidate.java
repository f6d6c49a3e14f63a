package com.company.matching.core.model;

import java.util.Objects;

/**
 * Proposed pairing of a web mention with its best-scoring registry entity.
 * Never mutated: re-classification produces a re-tagged copy via {@link #withMethod(MatchMethod)}.
 */
public record MatchCandidate(
        WebMention webMention,
        RegistryEntity registryEntity,
        double score,
        MatchMethod method
) {
    public MatchCandidate {
        Objects.requireNonNull(webMention, "webMention is required");
        Objects.requireNonNull(registryEntity, "registryEntity is required");
        Objects.requireNonNull(method, "method is required");
        if (score < 0.0 || score > 100.0) {
            throw new IllegalArgumentException("Score must be between 0 and 100, got " + score);
        }
    }

    public MatchCandidate withMethod(MatchMethod newMethod) {
        return new MatchCandidate(webMention, registryEntity, score, newMethod);
    }

    @Override
    public String toString() {
        return "MatchCandidate{web=" + webMention.id() +
                ", registry=" + registryEntity.registryNumber() +
                ", score=" + String.format("%.2f", score) +
                ", method=" + method + '}';
    }
}
