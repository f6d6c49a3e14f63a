package com.company.matching.metrics;

import com.company.matching.core.model.MatchBucket;
import com.company.matching.core.model.ReviewOutcome;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordBucket(MatchBucket bucket, int count) {
    }

    @Override
    public void recordOracleReview(ReviewOutcome outcome, Duration duration) {
    }

    @Override
    public void recordWrite(int companiesWritten, Duration duration) {
    }
}
