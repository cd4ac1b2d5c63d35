package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured classification of a mention's likely entity type, derived from its context.
 */
public record ContextSignal(
        EntityCategory entityType,
        double confidence,
        List<String> keywords,
        String description
) {
    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final String UNKNOWN_DESCRIPTION = "Unknown entity type";
    public static final String ERROR_DESCRIPTION = "Error in analysis";

    public ContextSignal {
        Objects.requireNonNull(entityType, "entityType is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
        description = description != null ? description : UNKNOWN_DESCRIPTION;
    }

    /**
     * Signal used when the classifier reply contained no JSON object at all.
     */
    public static ContextSignal unknown() {
        return new ContextSignal(EntityCategory.OTHER, DEFAULT_CONFIDENCE, List.of(), UNKNOWN_DESCRIPTION);
    }

    /**
     * Signal used when classification failed: malformed reply or transport error.
     */
    public static ContextSignal analysisError() {
        return new ContextSignal(EntityCategory.OTHER, DEFAULT_CONFIDENCE, List.of(), ERROR_DESCRIPTION);
    }

    /**
     * Returns true if this is one of the default signals substituted on failure.
     */
    public boolean isFallback() {
        return entityType == EntityCategory.OTHER
                && confidence == DEFAULT_CONFIDENCE
                && keywords.isEmpty()
                && (UNKNOWN_DESCRIPTION.equals(description) || ERROR_DESCRIPTION.equals(description));
    }
}
