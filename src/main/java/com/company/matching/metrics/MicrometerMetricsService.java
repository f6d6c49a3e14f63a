package com.company.matching.metrics;

import com.company.matching.core.model.MatchBucket;
import com.company.matching.core.model.ReviewOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code company.match.score} - DistributionSummary of best candidate scores (0-100)</li>
 *   <li>{@code company.match.bucket} - Counter (tag: bucket)</li>
 *   <li>{@code company.oracle.review} - Timer (tag: outcome)</li>
 *   <li>{@code company.unified.write} - Timer of unification writes</li>
 *   <li>{@code company.unified.written} - Counter of unified companies written</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchBucket, Counter> bucketCounters = new ConcurrentHashMap<>();
    private final Map<ReviewOutcome, Timer> reviewTimers = new ConcurrentHashMap<>();
    private final DistributionSummary scoreSummary;
    private final Timer writeTimer;
    private final Counter writtenCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.scoreSummary = DistributionSummary.builder("company.match.score")
                .description("Distribution of best candidate similarity scores")
                .register(registry);
        this.writeTimer = Timer.builder("company.unified.write")
                .description("Duration of unified company writes")
                .register(registry);
        this.writtenCounter = Counter.builder("company.unified.written")
                .description("Number of unified companies written")
                .register(registry);
    }

    @Override
    public void recordMatchScore(double score) {
        scoreSummary.record(score);
    }

    @Override
    public void recordBucket(MatchBucket bucket, int count) {
        Counter counter = bucketCounters.computeIfAbsent(bucket, b ->
                Counter.builder("company.match.bucket")
                        .description("Number of web mentions per match bucket")
                        .tag("bucket", b.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordOracleReview(ReviewOutcome outcome, Duration duration) {
        Timer timer = reviewTimers.computeIfAbsent(outcome, o ->
                Timer.builder("company.oracle.review")
                        .description("Duration of decision oracle reviews")
                        .tag("outcome", o.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordWrite(int companiesWritten, Duration duration) {
        writeTimer.record(duration);
        writtenCounter.increment(companiesWritten);
    }
}
