package com.brick.query.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
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
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * LLM provider for OpenAI-compatible {@code /v1/chat/completions} endpoints.
 *
 * <pre>
 * OpenAIChatProvider provider = OpenAIChatProvider.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("gpt-4o-mini")
 *     .build();
 * </pre>
 */
public class OpenAIChatProvider implements LLMProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAIChatProvider.class);

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OpenAIChatProvider(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.apiKey = builder.apiKey;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String complete(LLMRequest request) {
        if (!isAvailable()) {
            throw new LLMException("OpenAI provider has no API key configured");
        }
        log.debug("Calling chat completions with model: {}", model);
        try {
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/chat/completions"))
                    .timeout(request.timeout())
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(request)))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new LLMException("Chat completions returned status " + response.statusCode());
            }
            return extractContent(response.body());
        } catch (HttpTimeoutException e) {
            throw new LLMException("Chat completions call timed out after " + request.timeout(), e);
        } catch (IOException e) {
            throw new LLMException("Error calling chat completions: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LLMException("Interrupted while calling chat completions", e);
        }
    }

    @Override
    public String getProviderName() {
        return "OpenAI/" + model;
    }

    /**
     * Available when an API key is configured. No network round trip, the endpoint is billed per call.
     */
    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    String buildRequestBody(LLMRequest request) throws JsonProcessingException {
        ChatCompletionRequest body = new ChatCompletionRequest(
                model,
                List.of(new ChatMessage("system", request.systemPrompt()),
                        new ChatMessage("user", request.userMessage())),
                request.temperature(),
                request.jsonResponse() ? Map.of("type", "json_object") : null
        );
        return objectMapper.writeValueAsString(body);
    }

    String extractContent(String responseBody) throws JsonProcessingException {
        ChatCompletionResponse response = objectMapper.readValue(responseBody, ChatCompletionResponse.class);
        if (response.choices() == null || response.choices().isEmpty()) {
            throw new LLMException("Chat completion response contained no choices");
        }
        ChatMessage message = response.choices().get(0).message();
        if (message == null || message.content() == null || message.content().isBlank()) {
            throw new LLMException("Chat completion response contained no message content");
        }
        return message.content();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private String apiKey;
        private Duration connectTimeout;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public OpenAIChatProvider build() {
            return new OpenAIChatProvider(this);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record ChatCompletionRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            @JsonProperty("response_format") Map<String, String> responseFormat
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatMessage(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Choice(int index, ChatMessage message, @JsonProperty("finish_reason") String finishReason) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatCompletionResponse(String id, List<Choice> choices) {}
}
