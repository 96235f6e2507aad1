package com.cvjudge.engine.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
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
 * Judge adapter for OpenRouter's OpenAI-compatible chat-completions endpoint.
 *
 * One instance per judge: the model id is fixed at construction, so several
 * judges can share the same API key while routing to different models.
 */
public class OpenRouterJudgeClient implements JudgeClient {

    private static final String PROVIDER = "OpenRouter";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;
    private final String       model;
    private final double       temperature;

    public OpenRouterJudgeClient(String baseUrl, String apiKey, String model,
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
            // response_format asks the model for a bare JSON object; not every
            // routed model honours it, which is why the payload is still validated.
            requestBody = json.writeValueAsString(Map.of(
                    "model",           model,
                    "temperature",     temperature,
                    "response_format", Map.of("type", "json_object"),
                    "messages",        List.of(Map.of(
                            "role",    "user",
                            "content", JudgePrompts.evaluationPrompt(cvText, jdText, guidance)))
            ));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.FATAL, "Could not serialise request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/chat/completions"))
                .timeout(timeout)
                .header("Content-Type",  "application/json")
                .header("Authorization", "Bearer " + apiKey)
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
        return new RawJudgePayload(extractContent(response.body()));
    }

    /**
     * Pull {@code choices[0].message.content} out of a chat-completions body.
     *
     * OpenRouter reports some upstream failures as HTTP 200 with an
     * {@code error} object instead of choices; those are treated as transient.
     */
    String extractContent(String body) {
        JsonNode root;
        try {
            root = json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderException.Kind.MALFORMED,
                    "Unreadable " + PROVIDER + " response: " + e.getOriginalMessage(), e);
        }
        if (root.hasNonNull("error")) {
            throw new ProviderException(ProviderException.Kind.TRANSIENT,
                    PROVIDER + " upstream error: " + root.get("error").path("message").asText("unknown"));
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new ProviderException(ProviderException.Kind.MALFORMED,
                    PROVIDER + " response has no choices[0].message.content");
        }
        return content.asText();
    }
}
