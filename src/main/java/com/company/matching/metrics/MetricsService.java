package com.company.matching.metrics;

import com.company.matching.core.model.MatchBucket;
import com.company.matching.core.model.ReviewOutcome;

import java.time.Duration;

/**
 * Interface for recording company matching metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordMatchScore(double score);

    void recordBucket(MatchBucket bucket, int count);

    void recordOracleReview(ReviewOutcome outcome, Duration duration);

    void recordWrite(int companiesWritten, Duration duration);
}
