package com.brick.query.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * LLM provider implementation using the Ollama chat API.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * Install: https://ollama.ai
 * Pull model: ollama pull llama3.2
 *
 * Usage:
 * <pre>
 * OllamaLLMProvider provider = OllamaLLMProvider.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 *
 * QueryPipeline pipeline = QueryPipeline.builder()
 *     .llmProvider(provider)
 *     .options(PipelineOptions.withLLM())
 *     .build();
 * </pre>
 */
public class OllamaLLMProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(OllamaLLMProvider.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final String model;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaLLMProvider(Builder builder) {
        this.baseUrl = stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String complete(LLMRequest request) {
        log.debug("Calling Ollama chat with model: {}", model);
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/chat"))
                    .timeout(request.timeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LLMException("Ollama returned status " + response.statusCode() + ": " + response.body());
            }
            String content = extractContent(response.body());
            log.debug("Ollama response received, length: {}", content.length());
            return content;
        } catch (HttpTimeoutException e) {
            throw new LLMException("Ollama call timed out after " + request.timeout(), e);
        } catch (IOException e) {
            throw new LLMException("Error calling Ollama: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LLMException("Interrupted while calling Ollama", e);
        }
    }

    @Override
    public String getProviderName() {
        return "Ollama/" + model;
    }

    @Override
    public boolean isAvailable() {
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/api/tags"))
                    .timeout(Duration.ofSeconds(5))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return response.statusCode() == 200;
        } catch (IOException e) {
            log.debug("Ollama not available: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    String buildRequestBody(LLMRequest request) throws JsonProcessingException {
        OllamaChatRequest body = new OllamaChatRequest(
                model,
                List.of(new ChatMessage("system", request.systemPrompt()),
                        new ChatMessage("user", request.userMessage())),
                false,
                request.jsonResponse() ? "json" : null,
                new OllamaOptions(request.temperature())
        );
        return objectMapper.writeValueAsString(body);
    }

    String extractContent(String responseBody) throws JsonProcessingException {
        OllamaChatResponse response = objectMapper.readValue(responseBody, OllamaChatResponse.class);
        if (response.message() == null || response.message().content() == null
                || response.message().content().isBlank()) {
            throw new LLMException("Ollama response contained no message content");
        }
        return response.message().content();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama provider with llama3.2.
     */
    public static OllamaLLMProvider createDefault() {
        return builder().build();
    }

    /**
     * Creates an Ollama provider with a custom model.
     */
    public static OllamaLLMProvider withModel(String model) {
        return builder().model(model).build();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private Duration connectTimeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public OllamaLLMProvider build() {
            return new OllamaLLMProvider(this);
        }
    }

    // Request/Response DTOs for Ollama API
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record OllamaChatRequest(
            String model,
            List<ChatMessage> messages,
            boolean stream,
            String format,
            OllamaOptions options
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatMessage(String role, String content) {}

    private record OllamaOptions(double temperature) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaChatResponse(
            String model,
            ChatMessage message,
            boolean done
    ) {}
}
