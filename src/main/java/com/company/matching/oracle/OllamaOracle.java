package com.company.matching.oracle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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

/**
 * Decision oracle backed by a local Ollama server (default: http://localhost:11434).
 * Requests JSON-formatted output so the verdict can be parsed strictly.
 *
 * <pre>
 * OllamaOracle oracle = OllamaOracle.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaOracle implements DecisionOracle {
    private static final Logger log = LoggerFactory.getLogger(OllamaOracle.class);

    static final String DEFAULT_BASE_URL = "http://localhost:11434";
    static final String DEFAULT_MODEL = "llama3.2";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaOracle(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String complete(OraclePrompt prompt) throws OracleException {
        OllamaRequest ollamaRequest = new OllamaRequest(model, prompt.systemPrompt(), prompt.userPrompt(),
                "json", false);

        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(ollamaRequest);
        } catch (JsonProcessingException e) {
            throw new OracleException("Could not serialize Ollama request", e);
        }

        log.debug("Calling Ollama with model: {}", model);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/generate"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new OracleException("Ollama call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for Ollama", e);
        }

        if (response.statusCode() != 200) {
            throw new OracleException("Ollama returned status " + response.statusCode() + ": " + response.body());
        }

        OllamaResponse ollamaResponse;
        try {
            ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
        } catch (JsonProcessingException e) {
            throw new OracleException("Unreadable Ollama response", e);
        }
        if (ollamaResponse.response() == null) {
            throw new OracleException("Ollama response has no content");
        }

        log.debug("Ollama response received, length: {}", ollamaResponse.response().length());
        return ollamaResponse.response().strip();
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration timeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public OllamaOracle build() {
            return new OllamaOracle(this);
        }
    }

    // Request/Response DTOs for Ollama API
    private record OllamaRequest(
            String model,
            String system,
            String prompt,
            String format,
            boolean stream
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaResponse(
            String model,
            @JsonProperty("created_at") String createdAt,
            String response,
            boolean done
    ) {}
}
