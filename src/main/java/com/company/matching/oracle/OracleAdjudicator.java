package com.company.matching.oracle;

import com.company.matching.audit.OracleAuditEntry;
import com.company.matching.audit.OracleAuditLog;
import com.company.matching.core.model.MatchCandidate;
import com.company.matching.core.model.MatchMethod;
import com.company.matching.core.model.ReviewOutcome;
import com.company.matching.logging.LogContext;
import com.company.matching.metrics.MetricsService;
import com.company.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves a bounded number of ambiguous candidates through the decision oracle.
 *
 * <p>Only the first {@code maxReviews} candidates are sent, one call at a time and strictly
 * in input order; the rest are deferred untouched. Every response received is appended to
 * the audit log before it is parsed. A pair is accepted only when the verdict says it is a
 * match with medium or high confidence. A failure on one item (call error, malformed verdict,
 * audit write error) rejects that item and the batch continues.</p>
 *
 * <p>Acceptance is tracked per position, so two structurally identical candidates are
 * judged independently.</p>
 */
public class OracleAdjudicator {
    private static final Logger log = LoggerFactory.getLogger(OracleAdjudicator.class);

    private final OracleAvailability availability;
    private final OracleAuditLog auditLog;
    private final AdjudicationPromptBuilder promptBuilder;
    private final VerdictParser verdictParser;
    private final MetricsService metricsService;

    public OracleAdjudicator(OracleAvailability availability, OracleAuditLog auditLog) {
        this(availability, auditLog, new AdjudicationPromptBuilder(), new VerdictParser(), new NoOpMetricsService());
    }

    public OracleAdjudicator(OracleAvailability availability, OracleAuditLog auditLog,
                             AdjudicationPromptBuilder promptBuilder, VerdictParser verdictParser,
                             MetricsService metricsService) {
        this.availability = Objects.requireNonNull(availability, "availability is required");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog is required");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder is required");
        this.verdictParser = Objects.requireNonNull(verdictParser, "verdictParser is required");
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
    }

    /**
     * Reviews ambiguous candidates.
     *
     * @param ambiguous  candidates needing adjudication, in priority order
     * @param maxReviews maximum number of oracle calls for this pass (0 defers everything)
     * @return accepted and still-ambiguous candidates
     */
    public AdjudicationResult review(List<MatchCandidate> ambiguous, int maxReviews) {
        Objects.requireNonNull(ambiguous, "ambiguous is required");
        if (maxReviews < 0) {
            throw new IllegalArgumentException("maxReviews must not be negative");
        }

        if (ambiguous.isEmpty()) {
            log.info("No ambiguous matches to send to the decision oracle");
            return AdjudicationResult.skipped(List.of());
        }

        if (!availability.isAvailable()) {
            log.info("Decision oracle unavailable ({}), skipping review of {} ambiguous matches",
                    availability.reason().orElse("unknown"), ambiguous.size());
            return AdjudicationResult.skipped(ambiguous);
        }

        DecisionOracle oracle = availability.oracle().orElseThrow();
        int reviewCount = Math.min(maxReviews, ambiguous.size());
        List<MatchCandidate> toReview = ambiguous.subList(0, reviewCount);
        List<MatchCandidate> deferred = ambiguous.subList(reviewCount, ambiguous.size());

        log.info("adjudication.started provider={} toReview={} deferred={}",
                oracle.getProviderName(), toReview.size(), deferred.size());

        List<MatchCandidate> accepted = new ArrayList<>();
        List<MatchCandidate> rejected = new ArrayList<>();
        int failed = 0;

        for (int i = 0; i < toReview.size(); i++) {
            MatchCandidate candidate = toReview.get(i);
            ReviewOutcome outcome;
            long start = System.nanoTime();

            try (LogContext ctx = LogContext.forReview(i, candidate.webMention().id(),
                    candidate.registryEntity().registryNumber())) {
                outcome = reviewOne(oracle, candidate);
            }
            metricsService.recordOracleReview(outcome, Duration.ofNanos(System.nanoTime() - start));

            switch (outcome) {
                case ACCEPTED -> accepted.add(candidate.withMethod(MatchMethod.ORACLE_ASSISTED));
                case REJECTED -> rejected.add(candidate);
                case FAILED -> {
                    rejected.add(candidate);
                    failed++;
                }
            }
        }

        List<MatchCandidate> stillAmbiguous = new ArrayList<>(rejected.size() + deferred.size());
        stillAmbiguous.addAll(rejected);
        stillAmbiguous.addAll(deferred);

        log.info("adjudication.completed accepted={} rejected={} failed={} stillAmbiguous={}",
                accepted.size(), rejected.size() - failed, failed, stillAmbiguous.size());
        return new AdjudicationResult(accepted, stillAmbiguous, toReview.size(), failed);
    }

    private ReviewOutcome reviewOne(DecisionOracle oracle, MatchCandidate candidate) {
        OraclePrompt prompt = promptBuilder.build(candidate);
        try {
            String response = oracle.complete(prompt);
            auditLog.append(new OracleAuditEntry(prompt.userPrompt(), response));

            Verdict verdict = verdictParser.parse(response);
            log.info("Oracle verdict for {} vs {}: isMatch={}, confidence={}, reason={}",
                    candidate.webMention().id(), candidate.registryEntity().registryNumber(),
                    verdict.isMatch(), verdict.confidence(), verdict.reason());

            return verdict.isAcceptable() ? ReviewOutcome.ACCEPTED : ReviewOutcome.REJECTED;
        } catch (OracleException | RuntimeException e) {
            log.warn("Oracle review failed for {} vs {}: {}",
                    candidate.webMention().id(), candidate.registryEntity().registryNumber(), e.getMessage());
            return ReviewOutcome.FAILED;
        }
    }
}
