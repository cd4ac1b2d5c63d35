package com.entity.linking.core.model;

import java.util.Objects;

/**
 * A knowledge base entry proposed as a possible referent for a mention.
 * {@code rawType} and {@code rawDescription} come from source metadata and may be null.
 */
public record CandidateEntity(
        String identifier,
        String label,
        String rawType,
        String rawDescription,
        String knowledgeBase
) {
    public CandidateEntity {
        Objects.requireNonNull(identifier, "identifier is required");
        label = label != null ? label : identifier;
    }

    /**
     * Creates a candidate with identifier and label only.
     */
    public static CandidateEntity of(String identifier, String label) {
        return new CandidateEntity(identifier, label, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String identifier;
        private String label;
        private String rawType;
        private String rawDescription;
        private String knowledgeBase;

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder rawType(String rawType) {
            this.rawType = rawType;
            return this;
        }

        public Builder rawDescription(String rawDescription) {
            this.rawDescription = rawDescription;
            return this;
        }

        public Builder knowledgeBase(String knowledgeBase) {
            this.knowledgeBase = knowledgeBase;
            return this;
        }

        public CandidateEntity build() {
            return new CandidateEntity(identifier, label, rawType, rawDescription, knowledgeBase);
        }
    }
}
