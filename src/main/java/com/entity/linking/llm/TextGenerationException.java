package com.entity.linking.llm;

/**
 * Thrown when a text generation service cannot be reached or answers with an error.
 */
public class TextGenerationException extends RuntimeException {

    private final int statusCode;

    public TextGenerationException(String message) {
        this(message, -1, null);
    }

    public TextGenerationException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public TextGenerationException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the service, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
