package com.entity.linking.kb;

/**
 * Thrown when a knowledge base query cannot be executed or its reply cannot be read.
 */
public class KnowledgeBaseException extends RuntimeException {

    public KnowledgeBaseException(String message) {
        super(message);
    }

    public KnowledgeBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
