package com.brick.query.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Provider tests against a local HTTP stub; no model server is needed.
 */
class LLMProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static LLMRequest request() {
        return new LLMRequest("system", "Vis alle målere", 0.1, true, Duration.ofSeconds(5));
    }

    @Nested
    @DisplayName("LLMRequest")
    class RequestTests {

        @Test
        @DisplayName("null timeout should default")
        void defaultTimeout() {
            LLMRequest request = new LLMRequest("s", "u", 0.0, false, null);
            assertEquals(LLMRequest.DEFAULT_TIMEOUT, request.timeout());
        }

        @Test
        @DisplayName("invalid temperature and timeout should be rejected")
        void validation() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LLMRequest("s", "u", 2.5, false, null));
            assertThrows(IllegalArgumentException.class,
                    () -> new LLMRequest("s", "u", 0.1, false, Duration.ZERO));
            assertThrows(NullPointerException.class,
                    () -> new LLMRequest(null, "u", 0.1, false, null));
        }
    }

    @Nested
    @DisplayName("NoOp provider")
    class NoOpTests {

        @Test
        @DisplayName("should be unavailable and refuse to complete")
        void unavailable() {
            NoOpLLMProvider provider = new NoOpLLMProvider();
            assertFalse(provider.isAvailable());
            assertEquals("NoOp", provider.getProviderName());
            assertThrows(LLMException.class, () -> provider.complete(request()));
        }
    }

    @Nested
    @DisplayName("Ollama provider")
    class OllamaTests {

        @Test
        @DisplayName("provider name includes model")
        void providerName() {
            assertEquals("Ollama/llama3.2", OllamaLLMProvider.createDefault().getProviderName());
            assertEquals("Ollama/mistral", OllamaLLMProvider.withModel("mistral").getProviderName());
        }

        @Test
        @DisplayName("request body should carry both messages, JSON format and temperature")
        void requestBody() throws Exception {
            OllamaLLMProvider provider = OllamaLLMProvider.builder().model("llama3.2").build();

            JsonNode body = MAPPER.readTree(provider.buildRequestBody(request()));

            assertEquals("llama3.2", body.get("model").asText());
            assertFalse(body.get("stream").asBoolean());
            assertEquals("json", body.get("format").asText());
            assertEquals(0.1, body.get("options").get("temperature").asDouble(), 1e-9);
            assertEquals("system", body.get("messages").get(0).get("role").asText());
            assertEquals("Vis alle målere", body.get("messages").get(1).get("content").asText());
        }

        @Test
        @DisplayName("format should be omitted without JSON mode")
        void noJsonMode() throws Exception {
            OllamaLLMProvider provider = OllamaLLMProvider.createDefault();
            JsonNode body = MAPPER.readTree(provider.buildRequestBody(
                    new LLMRequest("s", "u", 0.1, false, null)));
            assertFalse(body.has("format"));
        }

        @Test
        @DisplayName("should extract message content and reject empty replies")
        void extractContent() throws Exception {
            OllamaLLMProvider provider = OllamaLLMProvider.createDefault();
            assertEquals("{\"intent_type\":\"query_list\"}", provider.extractContent(
                    "{\"model\":\"llama3.2\",\"message\":{\"role\":\"assistant\","
                            + "\"content\":\"{\\\"intent_type\\\":\\\"query_list\\\"}\"},\"done\":true,\"eval_count\":12}"));
            assertThrows(LLMException.class, () -> provider.extractContent("{\"done\":true}"));
        }

        @Test
        @DisplayName("unreachable server should be reported unavailable")
        void unreachable() {
            OllamaLLMProvider provider = OllamaLLMProvider.builder()
                    .baseUrl("http://127.0.0.1:1")
                    .connectTimeout(Duration.ofMillis(500))
                    .build();
            assertFalse(provider.isAvailable());
            assertThrows(LLMException.class, () -> provider.complete(request()));
        }
    }

    @Nested
    @DisplayName("Against a local HTTP stub")
    class StubServerTests {

        private HttpServer server;
        private final AtomicReference<String> lastBody = new AtomicReference<>();
        private final AtomicReference<String> lastAuth = new AtomicReference<>();

        @BeforeEach
        void startServer() throws IOException {
            server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
            server.createContext("/api/tags", exchange -> respond(exchange, 200, "{\"models\":[]}"));
            server.createContext("/api/chat", exchange -> {
                lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                respond(exchange, 200,
                        "{\"message\":{\"role\":\"assistant\",\"content\":\"{}\"},\"done\":true}");
            });
            server.createContext("/v1/chat/completions", exchange -> {
                lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
                lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
                respond(exchange, 200, "{\"id\":\"c1\",\"choices\":[{\"index\":0,"
                        + "\"message\":{\"role\":\"assistant\",\"content\":\"{\\\"intent_type\\\":\\\"unknown\\\"}\"},"
                        + "\"finish_reason\":\"stop\"}]}");
            });
            server.createContext("/broken/api/chat", exchange -> respond(exchange, 500, "model not loaded"));
            server.start();
        }

        @AfterEach
        void stopServer() {
            server.stop(0);
        }

        private String baseUrl() {
            return "http://127.0.0.1:" + server.getAddress().getPort();
        }

        private void respond(com.sun.net.httpserver.HttpExchange exchange, int status, String body) throws IOException {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }

        @Test
        @DisplayName("Ollama should be available and return the message content")
        void ollamaRoundTrip() {
            OllamaLLMProvider provider = OllamaLLMProvider.builder().baseUrl(baseUrl() + "/").build();

            assertTrue(provider.isAvailable());
            assertEquals("{}", provider.complete(request()));
            assertTrue(lastBody.get().contains("Vis alle målere"));
        }

        @Test
        @DisplayName("Ollama error status should raise LLMException")
        void ollamaErrorStatus() {
            OllamaLLMProvider provider = OllamaLLMProvider.builder().baseUrl(baseUrl() + "/broken").build();

            LLMException e = assertThrows(LLMException.class, () -> provider.complete(request()));
            assertTrue(e.getMessage().contains("500"));
        }

        @Test
        @DisplayName("chat completions should send the bearer token and JSON response format")
        void openAiRoundTrip() throws Exception {
            OpenAIChatProvider provider = OpenAIChatProvider.builder()
                    .baseUrl(baseUrl() + "/v1")
                    .model("gpt-4o-mini")
                    .apiKey("sk-test")
                    .build();

            assertEquals("{\"intent_type\":\"unknown\"}", provider.complete(request()));
            assertEquals("Bearer sk-test", lastAuth.get());
            JsonNode body = MAPPER.readTree(lastBody.get());
            assertEquals("json_object", body.get("response_format").get("type").asText());
            assertEquals("gpt-4o-mini", body.get("model").asText());
        }

        @Test
        @DisplayName("chat completions without an API key should be unavailable")
        void openAiWithoutKey() {
            OpenAIChatProvider provider = OpenAIChatProvider.builder().baseUrl(baseUrl() + "/v1").build();

            assertFalse(provider.isAvailable());
            assertEquals("OpenAI/gpt-4o-mini", provider.getProviderName());
            assertThrows(LLMException.class, () -> provider.complete(request()));
        }
    }
}
