package com.entity.linking.core.model;

import java.util.Objects;

/**
 * A candidate together with its context relevance score.
 */
public record ScoredCandidate(CandidateEntity candidate, double score) {

    public ScoredCandidate {
        Objects.requireNonNull(candidate, "candidate is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
    }

    public String identifier() {
        return candidate.identifier();
    }

    public String label() {
        return candidate.label();
    }
}
