package com.company.matching.oracle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Constructs the configured {@link DecisionOracle}.
 * Missing credentials, a disabled oracle, an unknown provider or a construction failure
 * all produce {@link OracleAvailability#unavailable(String)} instead of an exception.
 */
public class OracleConnector {
    private static final Logger log = LoggerFactory.getLogger(OracleConnector.class);

    public OracleAvailability connect(OracleSettings settings) {
        if (!settings.isEnabled()) {
            log.info("Decision oracle disabled by configuration");
            return OracleAvailability.unavailable("oracle disabled");
        }

        try {
            return switch (settings.getProvider()) {
                case OracleSettings.PROVIDER_OPENAI -> connectOpenAi(settings);
                case OracleSettings.PROVIDER_OLLAMA -> connectOllama(settings);
                default -> {
                    log.warn("Unknown oracle provider '{}', adjudication will be skipped", settings.getProvider());
                    yield OracleAvailability.unavailable("unknown provider: " + settings.getProvider());
                }
            };
        } catch (RuntimeException e) {
            log.warn("Could not construct decision oracle: {}", e.getMessage(), e);
            return OracleAvailability.unavailable("construction failed: " + e.getMessage());
        }
    }

    private OracleAvailability connectOpenAi(OracleSettings settings) {
        if (!settings.hasApiKey()) {
            log.warn("OPENAI_API_KEY not set, adjudication will be skipped");
            return OracleAvailability.unavailable("missing API key");
        }
        OpenAiChatOracle oracle = OpenAiChatOracle.builder()
                .apiKey(settings.getApiKey())
                .baseUrl(settings.getBaseUrl())
                .model(settings.getModel())
                .temperature(settings.getTemperature())
                .timeout(settings.getTimeout())
                .build();
        log.info("Decision oracle ready: {}", oracle.getProviderName());
        return OracleAvailability.available(oracle);
    }

    private OracleAvailability connectOllama(OracleSettings settings) {
        OllamaOracle oracle = OllamaOracle.builder()
                .baseUrl(settings.getBaseUrl())
                .model(settings.getModel())
                .timeout(settings.getTimeout())
                .build();
        log.info("Decision oracle ready: {}", oracle.getProviderName());
        return OracleAvailability.available(oracle);
    }
}
