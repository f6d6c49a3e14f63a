package com.company.matching.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Decision oracle backed by an OpenAI-compatible chat completions endpoint.
 *
 * <pre>
 * OpenAiChatOracle oracle = OpenAiChatOracle.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("gpt-4.1-mini")
 *     .build();
 * </pre>
 */
public class OpenAiChatOracle implements DecisionOracle {
    private static final Logger log = LoggerFactory.getLogger(OpenAiChatOracle.class);

    static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    static final String DEFAULT_MODEL = "gpt-4.1-mini";
    static final double DEFAULT_TEMPERATURE = 0.1;
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OpenAiChatOracle(Builder builder) {
        this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey is required");
        if (apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be blank");
        }
        this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.temperature = builder.temperature != null ? builder.temperature : DEFAULT_TEMPERATURE;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String complete(OraclePrompt prompt) throws OracleException {
        ChatRequest chatRequest = new ChatRequest(model, List.of(
                new ChatMessage("system", prompt.systemPrompt()),
                new ChatMessage("user", prompt.userPrompt())
        ), temperature);

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(chatRequest);
        } catch (JsonProcessingException e) {
            throw new OracleException("Could not serialize chat request", e);
        }

        log.debug("Calling chat completions with model: {}", model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleException("Chat completions call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for chat completions", e);
        }

        if (response.statusCode() != 200) {
            throw new OracleException("Chat completions returned status " + response.statusCode() + ": " + response.body());
        }

        ChatResponse chatResponse;
        try {
            chatResponse = objectMapper.readValue(response.body(), ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new OracleException("Unreadable chat completions response", e);
        }

        if (chatResponse.choices() == null || chatResponse.choices().isEmpty()
                || chatResponse.choices().get(0).message() == null
                || chatResponse.choices().get(0).message().content() == null) {
            throw new OracleException("Chat completions response has no message content");
        }

        String content = chatResponse.choices().get(0).message().content().strip();
        log.debug("Chat completions response received, length: {}", content.length());
        return content;
    }

    @Override
    public String getProviderName() {
        return "OpenAI/" + model;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKey;
        private String baseUrl;
        private String model;
        private Double temperature;
        private Duration timeout;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(double temperature) {
            if (temperature < 0.0 || temperature > 2.0) {
                throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
            }
            this.temperature = temperature;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OpenAiChatOracle build() {
            return new OpenAiChatOracle(this);
        }
    }

    // Request/Response DTOs for the chat completions API
    private record ChatRequest(
            String model,
            List<ChatMessage> messages,
            double temperature
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatMessage(
            String role,
            String content
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatChoice(
            int index,
            ChatMessage message
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatResponse(
            String id,
            String model,
            List<ChatChoice> choices
    ) {}
}
