package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of linking a single mention. Ranked candidates are sorted by descending score.
 */
public record LinkingResult(
        EntityMention entityMention,
        String canonicalName,
        ContextSignal contextSignal,
        List<ScoredCandidate> rankedCandidates,
        double overallConfidence,
        LinkingProvenance provenance
) {
    public LinkingResult {
        Objects.requireNonNull(entityMention, "entityMention is required");
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        Objects.requireNonNull(provenance, "provenance is required");
        rankedCandidates = rankedCandidates != null ? List.copyOf(rankedCandidates) : List.of();
        if (overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("Overall confidence must be between 0.0 and 1.0");
        }
        for (int i = 1; i < rankedCandidates.size(); i++) {
            if (rankedCandidates.get(i).score() > rankedCandidates.get(i - 1).score()) {
                throw new IllegalArgumentException("Ranked candidates must be sorted by descending score");
            }
        }
    }

    /**
     * Returns the context signal, absent when no context was supplied.
     */
    public Optional<ContextSignal> getContextSignal() {
        return Optional.ofNullable(contextSignal);
    }

    /**
     * Returns the best-scoring candidate, if any.
     */
    public Optional<ScoredCandidate> topCandidate() {
        return rankedCandidates.isEmpty() ? Optional.empty() : Optional.of(rankedCandidates.get(0));
    }

    public boolean hasCandidates() {
        return !rankedCandidates.isEmpty();
    }
}
