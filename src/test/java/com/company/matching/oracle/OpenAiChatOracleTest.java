package com.company.matching.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpenAiChatOracle Tests")
class OpenAiChatOracleTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> requestBody = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>();

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] body = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private OpenAiChatOracle oracle() {
        return OpenAiChatOracle.builder()
                .apiKey("sk-test")
                .baseUrl(baseUrl)
                .timeout(Duration.ofSeconds(5))
                .build();
    }

    private static String chatResponse(String content) {
        return "{\"id\":\"chatcmpl-1\",\"object\":\"chat.completion\",\"model\":\"gpt-4.1-mini\","
                + "\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":"
                + new TextNode(content) + "},\"finish_reason\":\"stop\"}],"
                + "\"usage\":{\"prompt_tokens\":10,\"completion_tokens\":5}}";
    }

    @Test
    @DisplayName("Should send system and user messages and return the stripped content")
    void testComplete() throws Exception {
        responseBody.set(chatResponse("  {\"is_match\": true, \"confidence\": \"high\", \"reason\": \"x\"}\n"));

        String content = oracle().complete(new OraclePrompt("system text", "user text"));

        assertEquals("{\"is_match\": true, \"confidence\": \"high\", \"reason\": \"x\"}", content);
        assertEquals("Bearer sk-test", authorization.get());

        JsonNode request = objectMapper.readTree(requestBody.get());
        assertEquals("gpt-4.1-mini", request.get("model").asText());
        assertEquals(0.1, request.get("temperature").asDouble(), 0.0001);
        assertEquals("system", request.get("messages").get(0).get("role").asText());
        assertEquals("system text", request.get("messages").get(0).get("content").asText());
        assertEquals("user", request.get("messages").get(1).get("role").asText());
        assertEquals("user text", request.get("messages").get(1).get("content").asText());
    }

    @Test
    @DisplayName("Non-success status is reported as an oracle failure")
    void testErrorStatus() {
        status.set(500);
        responseBody.set("{\"error\":{\"message\":\"server error\"}}");

        OracleException e = assertThrows(OracleException.class,
                () -> oracle().complete(new OraclePrompt("s", "u")));
        assertTrue(e.getMessage().contains("500"));
    }

    @Test
    @DisplayName("Response without choices is reported as an oracle failure")
    void testNoChoices() {
        responseBody.set("{\"id\":\"chatcmpl-1\",\"choices\":[]}");

        assertThrows(OracleException.class, () -> oracle().complete(new OraclePrompt("s", "u")));
    }

    @Test
    @DisplayName("Unreachable endpoint is reported as an oracle failure")
    void testUnreachable() {
        OpenAiChatOracle unreachable = OpenAiChatOracle.builder()
                .apiKey("sk-test")
                .baseUrl("http://127.0.0.1:1")
                .timeout(Duration.ofSeconds(2))
                .build();

        assertThrows(OracleException.class, () -> unreachable.complete(new OraclePrompt("s", "u")));
    }

    @Test
    @DisplayName("Builder requires a non-blank API key and a valid temperature")
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> OpenAiChatOracle.builder().build());
        assertThrows(IllegalArgumentException.class, () -> OpenAiChatOracle.builder().apiKey(" ").build());
        assertThrows(IllegalArgumentException.class, () -> OpenAiChatOracle.builder().temperature(2.5));
    }

    @Test
    @DisplayName("Provider name includes the model")
    void testProviderName() {
        assertEquals("OpenAI/gpt-4o", OpenAiChatOracle.builder().apiKey("k").model("gpt-4o").build().getProviderName());
    }
}
