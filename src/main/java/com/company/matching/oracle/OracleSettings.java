package com.company.matching.oracle;

import java.time.Duration;
import java.util.Locale;

/**
 * Settings used to construct a {@link DecisionOracle}.
 * Supported providers are {@code openai} (requires an API key) and {@code ollama}.
 */
public class OracleSettings {

    public static final String PROVIDER_OPENAI = "openai";
    public static final String PROVIDER_OLLAMA = "ollama";

    private final boolean enabled;
    private final String provider;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final Duration timeout;

    private OracleSettings(Builder builder) {
        this.enabled = builder.enabled;
        this.provider = builder.provider.toLowerCase(Locale.ROOT);
        this.apiKey = builder.apiKey;
        this.baseUrl = builder.baseUrl;
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.timeout = builder.timeout;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * API key for the provider, or null when none was configured.
     */
    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Base URL override, or null for the provider default.
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Model override, or null for the provider default.
     */
    public String getModel() {
        return model;
    }

    public double getTemperature() {
        return temperature;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * OpenAI settings reading the key from {@code OPENAI_API_KEY} and the model from {@code OPENAI_MODEL}.
     */
    public static OracleSettings fromEnvironment() {
        return builder()
                .provider(PROVIDER_OPENAI)
                .apiKey(System.getenv("OPENAI_API_KEY"))
                .model(System.getenv("OPENAI_MODEL"))
                .build();
    }

    /**
     * Settings for a disabled oracle; adjudication is skipped entirely.
     */
    public static OracleSettings disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean enabled = true;
        private String provider = PROVIDER_OPENAI;
        private String apiKey;
        private String baseUrl;
        private String model;
        private double temperature = OpenAiChatOracle.DEFAULT_TEMPERATURE;
        private Duration timeout = Duration.ofSeconds(60);

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder provider(String provider) {
            if (provider == null || provider.isBlank()) {
                throw new IllegalArgumentException("provider must not be blank");
            }
            this.provider = provider;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl != null && !baseUrl.isBlank() ? baseUrl : null;
            return this;
        }

        public Builder model(String model) {
            this.model = model != null && !model.isBlank() ? model : null;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public OracleSettings build() {
            return new OracleSettings(this);
        }
    }

    @Override
    public String toString() {
        return "OracleSettings{" +
                "enabled=" + enabled +
                ", provider='" + provider + '\'' +
                ", apiKey=" + (hasApiKey() ? "****" : "<none>") +
                ", baseUrl='" + baseUrl + '\'' +
                ", model='" + model + '\'' +
                ", temperature=" + temperature +
                ", timeout=" + timeout +
                '}';
    }
}
