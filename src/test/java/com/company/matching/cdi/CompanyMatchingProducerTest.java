package com.company.matching.cdi;

import com.company.matching.api.MatchingOptions;
import com.company.matching.api.PipelineContext;
import com.company.matching.classify.BelowThresholdPolicy;
import com.company.matching.classify.MatchingPolicy;
import com.company.matching.metrics.MicrometerMetricsService;
import com.company.matching.oracle.OracleAvailability;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CompanyMatchingProducerTest {

    private CompanyMatchingProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        producer = new CompanyMatchingProducer();
        producer.policy = "blanket_adjudicate";
        producer.highThreshold = 95.0;
        producer.lowThreshold = 0.0;
        producer.belowThreshold = "adjudicate";
        producer.oracleMaxReviews = 10;
        producer.oracleEnabled = true;
        producer.oracleProvider = "openai";
        producer.openAiApiKey = Optional.empty();
        producer.oracleBaseUrl = Optional.empty();
        producer.oracleModel = "gpt-4.1-mini";
        producer.oracleTemperature = 0.1;
        producer.oracleTimeoutSeconds = 60;
        producer.auditLogPath = "data/llm_match_logs.jsonl";
        producer.meterRegistry = mock(Instance.class);
    }

    @Test
    @DisplayName("Matching options are built from the configured values")
    void testMatchingOptions() {
        producer.policy = "thresholded";
        producer.highThreshold = 90.0;
        producer.lowThreshold = 75.0;
        producer.belowThreshold = "DISCARD";
        producer.oracleMaxReviews = 25;

        MatchingOptions options = producer.matchingOptions();

        assertEquals(MatchingPolicy.THRESHOLDED, options.getPolicy());
        assertEquals(90.0, options.getHighThreshold());
        assertEquals(BelowThresholdPolicy.DISCARD, options.getBelowThresholdPolicy());
        assertEquals(25, options.getOracleMaxReviews());
    }

    @Test
    @DisplayName("Unknown policy name is rejected")
    void testUnknownPolicy() {
        producer.policy = "sometimes";
        assertThrows(IllegalArgumentException.class, () -> producer.matchingOptions());
    }

    @Test
    @DisplayName("Without OPENAI_API_KEY the oracle is unavailable")
    void testOracleWithoutKey() {
        OracleAvailability availability = producer.oracleAvailability();

        assertFalse(availability.isAvailable());
    }

    @Test
    @DisplayName("With OPENAI_API_KEY the oracle is available")
    void testOracleWithKey() {
        producer.openAiApiKey = Optional.of("sk-test");

        OracleAvailability availability = producer.oracleAvailability();

        assertTrue(availability.isAvailable());
        assertEquals("OpenAI/gpt-4.1-mini", availability.oracle().orElseThrow().getProviderName());
    }

    @Test
    @DisplayName("Pipeline context uses the container's meter registry when present")
    void testPipelineContext() {
        MeterRegistry registry = new SimpleMeterRegistry();
        when(producer.meterRegistry.isResolvable()).thenReturn(true);
        when(producer.meterRegistry.get()).thenReturn(registry);

        PipelineContext context = producer.pipelineContext(OracleAvailability.unavailable("off"));

        assertInstanceOf(MicrometerMetricsService.class, context.getMetricsService());
        context.getMetricsService().recordMatchScore(100.0);
        assertEquals(1, registry.find("company.match.score").summary().count());
    }
}
