package com.company.matching.matching;

import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.MatchMethod;
import com.company.matching.core.model.RegistryEntity;
import com.company.matching.core.model.WebMention;
import com.company.matching.metrics.MetricsService;
import com.company.matching.metrics.NoOpMetricsService;
import com.company.matching.similarity.SimilarityAlgorithm;
import com.company.matching.similarity.TokenSortRatioSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Selects the single best-scoring registry entity for every web mention.
 *
 * <p>The scan is exhaustive: every matchable mention is compared with every registry
 * entity that has a normalized name. Only a strictly higher score replaces the current
 * best, so on ties the entity seen first in registry order wins.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);

    private final SimilarityAlgorithm similarity;
    private final MetricsService metricsService;

    public CandidateMatcher() {
        this(new TokenSortRatioSimilarity(), new NoOpMetricsService());
    }

    public CandidateMatcher(SimilarityAlgorithm similarity, MetricsService metricsService) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Matches web mentions against registry entities.
     *
     * @param registryEntities registry pool, in evaluation order
     * @param webMentions      web mentions to resolve, in output order
     * @return best candidates plus the mentions that could not be compared
     */
    public MatchingResult match(List<RegistryEntity> registryEntities, List<WebMention> webMentions) {
        Objects.requireNonNull(registryEntities, "registryEntities is required");
        Objects.requireNonNull(webMentions, "webMentions is required");

        if (webMentions.isEmpty()) {
            return MatchingResult.empty();
        }

        List<RegistryEntity> eligible = registryEntities.stream()
                .filter(RegistryEntity::hasName)
                .collect(Collectors.toList());

        log.info("matching.started webMentions={} registryEntities={} eligible={} algorithm={}",
                webMentions.size(), registryEntities.size(), eligible.size(), similarity.getName());

        List<MatchCandidate> candidates = new ArrayList<>();
        List<WebMention> unmatched = new ArrayList<>();

        for (WebMention mention : webMentions) {
            String mentionName = mention.nameNorm().strip();
            if (mentionName.isEmpty()) {
                unmatched.add(mention);
                continue;
            }

            MatchCandidate best = findBest(mention, mentionName, eligible);
            if (best == null) {
                unmatched.add(mention);
            } else {
                metricsService.recordMatchScore(best.score());
                candidates.add(best);
            }
        }

        log.info("matching.completed candidates={} unmatched={}", candidates.size(), unmatched.size());
        return new MatchingResult(candidates, unmatched);
    }

    private MatchCandidate findBest(WebMention mention, String mentionName, List<RegistryEntity> eligible) {
        double bestScore = -1.0;
        RegistryEntity bestEntity = null;

        for (RegistryEntity entity : eligible) {
            double score = toPercent(similarity.compute(mentionName, entity.nameNorm().strip()));
            if (score > bestScore) {
                bestScore = score;
                bestEntity = entity;
            }
        }

        if (bestEntity == null) {
            return null;
        }
        log.debug("Best candidate for '{}' is {} '{}' (score={})",
                mentionName, bestEntity.registryNumber(), bestEntity.nameNorm(), bestScore);
        return new MatchCandidate(mention, bestEntity, bestScore, MatchMethod.FUZZY_NAME);
    }

    private static double toPercent(double similarityScore) {
        return Math.max(0.0, Math.min(100.0, similarityScore * 100.0));
    }
}
