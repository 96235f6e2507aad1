package com.cvjudge.engine.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

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
 * Judge adapter for the Anthropic Messages API.
 *
 * Raw HttpClient rather than an SDK: the endpoint is a single POST and we
 * need the status code to classify failures for the retry loop.
 */
public class AnthropicJudgeClient implements JudgeClient {

    /** A single message in the conversation. Judges only ever send one user turn. */
    public record Message(String role, String content) {}

    /** The subset of the API response we care about. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            if (content == null) {
                throw new IllegalStateException("No content in response");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    private static final String PROVIDER   = "Anthropic";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final double       temperature;

    public AnthropicJudgeClient(String baseUrl, String apiKey, String model,
                                double temperature, ObjectMapper objectMapper) {
        this.baseUrl     = baseUrl;
        this.apiKey      = apiKey == null ? "" : apiKey;
        this.model       = model;
        this.temperature = temperature;
        this.json        = objectMapper;
        this.http        = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public RawJudgePayload call(String cvText, String jdText, String guidance, Duration timeout) {
        String requestBody;
        try {
            requestBody = json.writeValueAsString(Map.of(
                    "model",       model,
                    "max_tokens",  MAX_TOKENS,
                    "temperature", temperature,
                    "messages",    List.of(new Message("user",
                            JudgePrompts.evaluationPrompt(cvText, jdText, guidance)))
            ));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.FATAL, "Could not serialise request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/v1/messages"))
                .timeout(timeout)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    PROVIDER + " call timed out after " + timeout, e);
        } catch (IOException e) {
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    PROVIDER + " call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    PROVIDER + " call interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw ProviderException.fromStatus(PROVIDER, response.statusCode(), response.body());
        }

        try {
            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return new RawJudgePayload(parsed.firstText());
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new ProviderException(ProviderException.Kind.MALFORMED,
                    "Unreadable " + PROVIDER + " response: " + e.getMessage(), e);
        }
    }
}
