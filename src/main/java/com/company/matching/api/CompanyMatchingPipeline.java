package com.company.matching.api;

import com.company.matching.classify.ClassificationResult;
import com.company.matching.classify.TierClassifier;
import com.company.matching.core.model.MatchBucket;
import com.company.matching.core.model.MatchCandidate;
import com.company.matching.logging.LogContext;
import com.company.matching.matching.CandidateMatcher;
import com.company.matching.matching.MatchingResult;
import com.company.matching.metrics.MetricsService;
import com.company.matching.oracle.AdjudicationPromptBuilder;
import com.company.matching.oracle.AdjudicationResult;
import com.company.matching.oracle.OracleAdjudicator;
import com.company.matching.oracle.VerdictParser;
import com.company.matching.persistence.UnifiedCompanyWriter;
import com.company.matching.persistence.WriteResult;
import com.company.matching.similarity.SimilarityAlgorithm;
import com.company.matching.similarity.TokenSortRatioSimilarity;
import com.company.matching.source.SourceData;
import com.company.matching.source.SourceFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point: loads the source records, matches, classifies, adjudicates and writes
 * the accepted pairs as unified companies.
 *
 * <pre>
 * PipelineContext context = PipelineContext.create(OracleSettings.fromEnvironment());
 *
 * CompanyMatchingPipeline pipeline = CompanyMatchingPipeline.builder()
 *     .sourceFeed(new JdbcSourceFeed(dataSource))
 *     .writer(new JdbcUnifiedCompanyWriter(dataSource))
 *     .context(context)
 *     .options(MatchingOptions.defaults())
 *     .build();
 *
 * RunSummary summary = pipeline.run();
 * </pre>
 *
 * <p>Runs are single-threaded and synchronous. Concurrent runs against the same store
 * must be serialized by the caller.</p>
 */
public class CompanyMatchingPipeline {
    private static final Logger log = LoggerFactory.getLogger(CompanyMatchingPipeline.class);

    private final SourceFeed sourceFeed;
    private final UnifiedCompanyWriter writer;
    private final MatchingOptions options;
    private final MetricsService metricsService;
    private final CandidateMatcher matcher;
    private final TierClassifier classifier;
    private final OracleAdjudicator adjudicator;

    private CompanyMatchingPipeline(Builder builder) {
        this.sourceFeed = builder.sourceFeed;
        this.writer = Objects.requireNonNull(builder.writer, "writer is required");
        PipelineContext context = Objects.requireNonNull(builder.context, "context is required");
        this.options = builder.options != null ? builder.options : MatchingOptions.defaults();
        this.metricsService = context.getMetricsService();

        SimilarityAlgorithm similarity = builder.similarity != null
                ? builder.similarity : new TokenSortRatioSimilarity();
        this.matcher = new CandidateMatcher(similarity, metricsService);
        this.classifier = new TierClassifier(options);
        this.adjudicator = new OracleAdjudicator(context.getOracleAvailability(), context.getAuditLog(),
                new AdjudicationPromptBuilder(), new VerdictParser(), metricsService);
    }

    /**
     * Loads records from the configured source feed and runs the pipeline.
     *
     * @throws IllegalStateException if no source feed was configured
     */
    public RunSummary run() {
        if (sourceFeed == null) {
            throw new IllegalStateException("No source feed configured; use run(SourceData)");
        }
        return run(sourceFeed.load());
    }

    /**
     * Runs the pipeline over the given records.
     *
     * @throws com.company.matching.persistence.UnificationWriteException if the write fails (after rollback)
     */
    public RunSummary run(SourceData data) {
        Objects.requireNonNull(data, "data is required");
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("pipeline.started registryEntities={} webMentions={} options={}",
                    data.registryEntities().size(), data.webMentions().size(), options);

            MatchingResult matching = matcher.match(data.registryEntities(), data.webMentions());
            ClassificationResult classification = classifier.classify(matching.candidates());
            AdjudicationResult adjudication = adjudicator.review(
                    classification.needsAdjudication(), options.getOracleMaxReviews());

            List<MatchCandidate> toWrite = new ArrayList<>(classification.autoAccept());
            toWrite.addAll(adjudication.accepted());
            WriteResult written = writer.write(toWrite);

            RunSummary summary = new RunSummary(
                    data.registryEntities().size(),
                    data.webMentions().size(),
                    classification.autoAccept().size(),
                    adjudication.accepted().size(),
                    adjudication.stillAmbiguous().size(),
                    classification.discarded().size(),
                    matching.unmatched().size(),
                    written.companiesWritten());

            recordBuckets(summary);
            log.info("pipeline.completed summary={}", summary);
            return summary;
        }
    }

    private void recordBuckets(RunSummary summary) {
        metricsService.recordBucket(MatchBucket.AUTO_ACCEPTED, summary.autoAccepted());
        metricsService.recordBucket(MatchBucket.ORACLE_ACCEPTED, summary.oracleAccepted());
        metricsService.recordBucket(MatchBucket.STILL_AMBIGUOUS, summary.stillAmbiguous());
        metricsService.recordBucket(MatchBucket.DISCARDED, summary.discarded());
        metricsService.recordBucket(MatchBucket.UNMATCHED, summary.unmatched());
    }

    public MatchingOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SourceFeed sourceFeed;
        private UnifiedCompanyWriter writer;
        private PipelineContext context;
        private MatchingOptions options;
        private SimilarityAlgorithm similarity;

        public Builder sourceFeed(SourceFeed sourceFeed) {
            this.sourceFeed = sourceFeed;
            return this;
        }

        public Builder writer(UnifiedCompanyWriter writer) {
            this.writer = writer;
            return this;
        }

        public Builder context(PipelineContext context) {
            this.context = context;
            return this;
        }

        public Builder options(MatchingOptions options) {
            this.options = options;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public CompanyMatchingPipeline build() {
            return new CompanyMatchingPipeline(this);
        }
    }
}
