package com.entity.linking.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Text generation client for the Gemini {@code generateContent} REST API.
 *
 * Usage:
 * <pre>
 * TextGenerationClient gemini = new GeminiTextGenerationClient(
 *     TextGenerationConfig.fromEnvironment(System.getenv()));
 *
 * LinkingEngine engine = LinkingEngine.builder()
 *     .textGenerationClient(gemini)
 *     .candidateSource(new DBpediaCandidateSource())
 *     .build();
 * </pre>
 */
public class GeminiTextGenerationClient implements TextGenerationClient {
    private static final Logger log = LoggerFactory.getLogger(GeminiTextGenerationClient.class);

    private final TextGenerationConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiTextGenerationClient(TextGenerationConfig config) {
        this(config, HttpClient.newBuilder().connectTimeout(config.timeout()).build());
    }

    GeminiTextGenerationClient(TextGenerationConfig config, HttpClient httpClient) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String generate(String prompt) {
        Objects.requireNonNull(prompt, "prompt is required");
        log.debug("Calling Gemini model={} promptLength={}", config.model(), prompt.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(requestUri())
                .timeout(config.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildRequestBody(prompt)))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TextGenerationException("Gemini request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException("Gemini request interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.debug("Gemini error response: {}", response.body());
            throw new TextGenerationException(
                    "Gemini returned status " + response.statusCode(), response.statusCode(), null);
        }
        return extractText(response.body());
    }

    @Override
    public String getName() {
        return "Gemini";
    }

    @Override
    public boolean isAvailable() {
        return config.hasApiKey();
    }

    public TextGenerationConfig getConfig() {
        return config;
    }

    String buildRequestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
                .addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TextGenerationException("Could not serialize Gemini request", e);
        }
    }

    /**
     * Extracts {@code candidates[0].content.parts[0].text}. When the reply does not have
     * that shape the raw body is returned for the caller to parse.
     */
    String extractText(String body) {
        try {
            JsonNode text = objectMapper.readTree(body)
                    .path("candidates").path(0)
                    .path("content").path("parts").path(0)
                    .path("text");
            if (text.isTextual()) {
                return text.asText();
            }
            log.warn("Gemini response has no candidate text, returning raw body");
        } catch (JsonProcessingException e) {
            log.warn("Gemini response is not JSON, returning raw body: {}", e.getOriginalMessage());
        }
        return body;
    }

    private URI requestUri() {
        if (!config.hasApiKey()) {
            return URI.create(config.endpoint());
        }
        String separator = config.endpoint().contains("?") ? "&" : "?";
        return URI.create(config.endpoint() + separator + "key="
                + URLEncoder.encode(config.apiKey(), StandardCharsets.UTF_8));
    }
}
