package com.entity.linking.llm;

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
 * Text generation client backed by a local Ollama server.
 *
 * Ollama must be running locally (default: http://localhost:11434).
 * Install: https://ollama.ai
 * Pull model: ollama pull llama3.2
 *
 * Usage:
 * <pre>
 * OllamaTextGenerationClient client = OllamaTextGenerationClient.builder()
 *     .baseUrl("http://localhost:11434")
 *     .model("llama3.2")
 *     .build();
 * </pre>
 */
public class OllamaTextGenerationClient implements TextGenerationClient {
    private static final Logger log = LoggerFactory.getLogger(OllamaTextGenerationClient.class);

    private static final String DEFAULT_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_MODEL = "llama3.2";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OllamaTextGenerationClient(Builder builder) {
        this.baseUrl = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String generate(String prompt) {
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(new OllamaRequest(model, prompt, false));
        } catch (JsonProcessingException e) {
            throw new TextGenerationException("Could not serialize Ollama request", e);
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
            throw new TextGenerationException("Ollama request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException("Ollama request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new TextGenerationException("Ollama returned status " + response.statusCode()
                    + ": " + response.body(), response.statusCode(), null);
        }

        try {
            OllamaResponse ollamaResponse = objectMapper.readValue(response.body(), OllamaResponse.class);
            String text = ollamaResponse.response() != null ? ollamaResponse.response() : "";
            log.debug("Ollama response received, length: {}", text.length());
            return text;
        } catch (JsonProcessingException e) {
            throw new TextGenerationException("Ollama returned an unreadable body", e);
        }
    }

    @Override
    public String getName() {
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

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default Ollama client with llama3.2.
     */
    public static OllamaTextGenerationClient createDefault() {
        return builder().build();
    }

    /**
     * Creates an Ollama client for the given model.
     */
    public static OllamaTextGenerationClient withModel(String model) {
        return builder().model(model).build();
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

        /**
         * Applies endpoint, model and timeout from a shared configuration.
         */
        public Builder config(TextGenerationConfig config) {
            this.baseUrl = config.endpoint();
            this.model = config.model();
            this.timeout = config.timeout();
            return this;
        }

        public OllamaTextGenerationClient build() {
            return new OllamaTextGenerationClient(this);
        }
    }

    // Request/Response DTOs for the Ollama API
    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OllamaRequest(
            String model,
            String prompt,
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
