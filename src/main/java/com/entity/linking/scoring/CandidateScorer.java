package com.entity.linking.scoring;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityCategory;
import com.entity.linking.core.model.ScoredCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores candidates against a context signal with a deterministic additive model.
 *
 * <p>Formula, starting from the base score:</p>
 * <ul>
 *   <li>type match: raw type (or identifier when no type is known) contains a term of the
 *       signal's category, or a smaller bonus for an adjacent category</li>
 *   <li>keywords: each keyword found in the identifier, and each found in the description</li>
 *   <li>domain terms: company signal and a description using company vocabulary</li>
 *   <li>confidence transfer: signal confidence times a weight</li>
 * </ul>
 * The total is capped at {@link ScoringWeights#maxScore()}. Without a signal every candidate
 * gets the base score. Scores never go negative.
 */
public class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    private static final Comparator<ScoredCandidate> BY_SCORE_DESCENDING =
            Comparator.comparingDouble(ScoredCandidate::score).reversed();

    private final ScoringWeights weights;

    public CandidateScorer() {
        this(ScoringWeights.defaultWeights());
    }

    public CandidateScorer(ScoringWeights weights) {
        this.weights = weights != null ? weights : ScoringWeights.defaultWeights();
    }

    /**
     * Computes the relevance score of a candidate.
     *
     * @param candidate     the candidate
     * @param contextSignal the signal, or null when no context is available
     * @return score between 0.0 and the configured maximum
     */
    public double score(CandidateEntity candidate, ContextSignal contextSignal) {
        return explain(candidate, contextSignal).total();
    }

    /**
     * Computes the score with a per-component breakdown.
     */
    public ScoreBreakdown explain(CandidateEntity candidate, ContextSignal contextSignal) {
        if (contextSignal == null) {
            return new ScoreBreakdown(weights.baseScore(), 0.0, 0.0, 0.0, 0.0, weights.baseScore());
        }

        EntityCategory expected = contextSignal.entityType();
        String typeEvidence = candidate.rawType() != null ? candidate.rawType() : candidate.identifier();

        double typeBonus = 0.0;
        if (TypeVocabulary.matches(expected, typeEvidence)) {
            typeBonus = weights.typeMatch();
        } else if (TypeVocabulary.partiallyMatches(expected, typeEvidence)) {
            typeBonus = weights.partialTypeMatch();
        }

        String identifier = candidate.identifier().toLowerCase(Locale.ROOT);
        String description = candidate.rawDescription() != null
                ? candidate.rawDescription().toLowerCase(Locale.ROOT) : "";
        double keywordBonus = 0.0;
        for (String keyword : contextSignal.keywords()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String term = keyword.toLowerCase(Locale.ROOT);
            if (identifier.contains(term)) {
                keywordBonus += weights.keywordInIdentifier();
            }
            if (description.contains(term)) {
                keywordBonus += weights.keywordInDescription();
            }
        }

        double domainBonus = 0.0;
        if (expected == EntityCategory.COMPANY
                && TypeVocabulary.containsAny(description, TypeVocabulary.COMPANY_DOMAIN_TERMS)) {
            domainBonus = weights.domainTerm();
        }

        double confidenceBonus = contextSignal.confidence() * weights.confidenceTransfer();

        double raw = weights.baseScore() + typeBonus + keywordBonus + domainBonus + confidenceBonus;
        double total = Math.min(raw, weights.maxScore());

        log.debug("Score for '{}': type={}, keywords={}, domain={}, confidence={}, total={}",
                candidate.identifier(), typeBonus, keywordBonus, domainBonus, confidenceBonus, total);

        return new ScoreBreakdown(weights.baseScore(), typeBonus, keywordBonus, domainBonus,
                confidenceBonus, total);
    }

    /**
     * Scores and ranks candidates, descending by score. Ties keep arrival order.
     *
     * @param limit maximum number of candidates to return
     */
    public List<ScoredCandidate> rank(List<CandidateEntity> candidates, ContextSignal contextSignal, int limit) {
        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (CandidateEntity candidate : candidates) {
            scored.add(new ScoredCandidate(candidate, score(candidate, contextSignal)));
        }
        // List.sort is stable, which keeps source order among equal scores
        scored.sort(BY_SCORE_DESCENDING);
        return scored.size() > limit ? List.copyOf(scored.subList(0, limit)) : List.copyOf(scored);
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    /**
     * Per-component contributions to a candidate score.
     */
    public record ScoreBreakdown(
            double base,
            double typeBonus,
            double keywordBonus,
            double domainBonus,
            double confidenceBonus,
            double total
    ) {
        @Override
        public String toString() {
            return String.format(
                    "ScoreBreakdown{base=%.2f, type=%.2f, keywords=%.2f, domain=%.2f, confidence=%.2f, total=%.4f}",
                    base, typeBonus, keywordBonus, domainBonus, confidenceBonus, total);
        }
    }
}
