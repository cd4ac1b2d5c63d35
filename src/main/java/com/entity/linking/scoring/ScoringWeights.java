package com.entity.linking.scoring;

/**
 * Weights of the additive context scoring model.
 */
public record ScoringWeights(
        double baseScore,
        double typeMatch,
        double partialTypeMatch,
        double keywordInIdentifier,
        double keywordInDescription,
        double domainTerm,
        double confidenceTransfer,
        double maxScore
) {
    public ScoringWeights {
        if (baseScore < 0 || typeMatch < 0 || partialTypeMatch < 0 || keywordInIdentifier < 0
                || keywordInDescription < 0 || domainTerm < 0 || confidenceTransfer < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        if (maxScore <= 0 || maxScore > 1.0) {
            throw new IllegalArgumentException("maxScore must be in (0.0, 1.0], got " + maxScore);
        }
        if (baseScore > maxScore) {
            throw new IllegalArgumentException("baseScore must not exceed maxScore");
        }
    }

    /**
     * The default model: base 0.5, full type match +0.4, adjacent type +0.2,
     * keyword in identifier +0.1, keyword in description +0.15, company vocabulary +0.2,
     * context confidence x 0.2, capped at 1.0.
     */
    public static ScoringWeights defaultWeights() {
        return new ScoringWeights(0.5, 0.4, 0.2, 0.1, 0.15, 0.2, 0.2, 1.0);
    }

    /**
     * Weights that ignore keywords and rely on type evidence only.
     */
    public static ScoringWeights typeFocused() {
        return new ScoringWeights(0.5, 0.4, 0.2, 0.0, 0.0, 0.2, 0.2, 1.0);
    }
}
