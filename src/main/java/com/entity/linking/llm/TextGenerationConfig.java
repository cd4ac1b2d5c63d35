package com.entity.linking.llm;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for a text generation client.
 * Credentials are passed in explicitly at construction time.
 *
 * <p>When no endpoint is given, the Gemini {@code generateContent} endpoint of the configured
 * model is used.</p>
 */
public record TextGenerationConfig(
        String apiKey,
        String endpoint,
        String model,
        Duration timeout
) {
    public static final String GEMINI_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/models/";
    public static final String GEMINI_MODEL = "gemini-2.0-flash";
    public static final String GEMINI_ENDPOINT = geminiEndpoint(GEMINI_MODEL);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public static final String API_KEY_VARIABLE = "GEMINI_API_KEY";
    public static final String ENDPOINT_VARIABLE = "GEMINI_API_URL";
    public static final String MODEL_VARIABLE = "GEMINI_MODEL";

    public TextGenerationConfig {
        model = model != null && !model.isBlank() ? model : GEMINI_MODEL;
        endpoint = endpoint != null && !endpoint.isBlank() ? endpoint : geminiEndpoint(model);
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /**
     * Builds a Gemini configuration from a map of variables supplied by the caller,
     * typically {@code System.getenv()}.
     *
     * @throws IllegalArgumentException if no api key is present
     */
    public static TextGenerationConfig fromEnvironment(Map<String, String> variables) {
        String apiKey = variables.get(API_KEY_VARIABLE);
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException(API_KEY_VARIABLE + " is not set");
        }
        return builder()
                .apiKey(apiKey)
                .endpoint(variables.get(ENDPOINT_VARIABLE))
                .model(variables.getOrDefault(MODEL_VARIABLE, GEMINI_MODEL))
                .build();
    }

    public static String geminiEndpoint(String model) {
        return GEMINI_BASE_URL + model + ":generateContent";
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "TextGenerationConfig{endpoint=" + endpoint + ", model=" + model +
                ", timeout=" + timeout + ", apiKey=" + (hasApiKey() ? "****" : "none") + '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String apiKey;
        private String endpoint;
        private String model = GEMINI_MODEL;
        private Duration timeout = DEFAULT_TIMEOUT;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
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

        public TextGenerationConfig build() {
            return new TextGenerationConfig(apiKey, endpoint, model, timeout);
        }
    }
}
