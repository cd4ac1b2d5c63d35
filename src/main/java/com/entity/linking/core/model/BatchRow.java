package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One reconciled output record of the batch pipeline.
 * Every value derived from an external service is nullable.
 */
public record BatchRow(
        String mention,
        String context,
        String canonicalName,
        EntityCategory entityType,
        Double confidence,
        List<String> keywords,
        String description,
        String topCandidateUri,
        Double topCandidateScore
) {
    public BatchRow {
        Objects.requireNonNull(mention, "mention is required");
        keywords = keywords != null ? List.copyOf(keywords) : List.of();
    }

    /**
     * Returns true when the row is missing either a canonical name or a knowledge base URI.
     */
    public boolean isErrorOrAmbiguous() {
        return canonicalName == null || topCandidateUri == null;
    }

    public EntityMention toMention() {
        return new EntityMention(mention, context);
    }
}
