package com.entity.linking.scoring;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityCategory;
import com.entity.linking.core.model.ScoredCandidate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateScorer Tests")
class CandidateScorerTest {

    private final CandidateScorer scorer = new CandidateScorer();

    private static final CandidateEntity APPLE_INC = CandidateEntity.builder()
            .identifier("http://dbpedia.org/resource/Apple_Inc.")
            .label("Apple Inc.")
            .rawType("http://dbpedia.org/ontology/Organisation http://dbpedia.org/ontology/Company")
            .rawDescription("Apple Inc. is an American multinational technology company")
            .build();

    private static final CandidateEntity APPLE_FRUIT = CandidateEntity.builder()
            .identifier("http://dbpedia.org/resource/Apple")
            .label("Apple")
            .rawType("http://dbpedia.org/ontology/Food")
            .rawDescription("An apple is an edible fruit produced by an apple tree")
            .build();

    private static ContextSignal signal(EntityCategory type, double confidence, String... keywords) {
        return new ContextSignal(type, confidence, List.of(keywords), "test");
    }

    @Nested
    @DisplayName("Score components")
    class ComponentTests {

        @Test
        @DisplayName("Without a signal every candidate gets the base score")
        void noSignal() {
            assertEquals(0.5, scorer.score(APPLE_INC, null));
            assertEquals(0.5, scorer.score(APPLE_FRUIT, null));
        }

        @Test
        @DisplayName("Organisation type is boosted by a company signal")
        void organisationBoost() {
            CandidateScorer.ScoreBreakdown breakdown = scorer.explain(APPLE_INC, signal(EntityCategory.COMPANY, 0.0));
            assertEquals(0.4, breakdown.typeBonus(), 1e-9);
            assertEquals(0.2, breakdown.domainBonus(), 1e-9);
            assertTrue(scorer.score(APPLE_INC, signal(EntityCategory.COMPANY, 0.9))
                    > scorer.score(APPLE_FRUIT, signal(EntityCategory.COMPANY, 0.9)));
        }

        @Test
        @DisplayName("Brand type earns the partial bonus for a company signal")
        void partialTypeMatch() {
            CandidateEntity brand = CandidateEntity.builder().identifier("KB:Brand").rawType("Brand").build();
            assertEquals(0.2, scorer.explain(brand, signal(EntityCategory.COMPANY, 0.0)).typeBonus(), 1e-9);
        }

        @Test
        @DisplayName("Identifier is the type evidence when no raw type is known")
        void identifierAsTypeEvidence() {
            CandidateEntity untyped = CandidateEntity.of("KB:Acme_Corporation", "Acme");
            assertEquals(0.4, scorer.explain(untyped, signal(EntityCategory.COMPANY, 0.0)).typeBonus(), 1e-9);
        }

        @Test
        @DisplayName("Keywords count in identifier and description, blanks are ignored")
        void keywordBonus() {
            CandidateScorer.ScoreBreakdown breakdown = scorer.explain(APPLE_FRUIT,
                    signal(EntityCategory.OTHER, 0.0, "apple", "FRUIT", " "));
            // apple: identifier and description; fruit: description only
            assertEquals(0.1 + 0.15 + 0.15, breakdown.keywordBonus(), 1e-9);
        }

        @Test
        @DisplayName("Confidence transfers a fraction of the signal confidence")
        void confidenceTransfer() {
            CandidateEntity plain = CandidateEntity.of("KB:X", "X");
            assertEquals(0.5 + 0.8 * 0.2, scorer.score(plain, signal(EntityCategory.OTHER, 0.8)), 1e-9);
        }
    }

    @ParameterizedTest
    @EnumSource(EntityCategory.class)
    @DisplayName("Scores stay within [0, 1] and are deterministic")
    void boundsAndDeterminism(EntityCategory type) {
        ContextSignal strong = signal(type, 1.0, "apple", "company", "technology", "fruit", "inc");
        for (CandidateEntity candidate : List.of(APPLE_INC, APPLE_FRUIT)) {
            double first = scorer.score(candidate, strong);
            assertTrue(first >= 0.0 && first <= 1.0);
            assertEquals(first, scorer.score(candidate, strong));
        }
    }

    @Test
    @DisplayName("Total is capped at the maximum score")
    void capped() {
        ContextSignal strong = signal(EntityCategory.COMPANY, 1.0, "apple", "technology");
        assertEquals(1.0, scorer.score(APPLE_INC, strong));
    }

    @Nested
    @DisplayName("Ranking")
    class RankingTests {

        @Test
        @DisplayName("Ranks descending and truncates to the limit")
        void ranksAndTruncates() {
            List<ScoredCandidate> ranked = scorer.rank(List.of(APPLE_FRUIT, APPLE_INC),
                    signal(EntityCategory.COMPANY, 0.9), 1);
            assertEquals(1, ranked.size());
            assertEquals(APPLE_INC.identifier(), ranked.get(0).identifier());
        }

        @Test
        @DisplayName("Equal scores keep arrival order")
        void stableTies() {
            List<ScoredCandidate> ranked = scorer.rank(List.of(APPLE_FRUIT, APPLE_INC), null, 5);
            assertEquals(List.of(APPLE_FRUIT.identifier(), APPLE_INC.identifier()),
                    ranked.stream().map(ScoredCandidate::identifier).toList());
        }

        @Test
        @DisplayName("Custom weights change the ranking model")
        void customWeights() {
            CandidateScorer typeOnly = new CandidateScorer(ScoringWeights.typeFocused());
            assertEquals(0.0, typeOnly.explain(APPLE_FRUIT,
                    signal(EntityCategory.OTHER, 0.0, "fruit")).keywordBonus());
        }
    }

    @Test
    @DisplayName("Invalid weights are rejected")
    void invalidWeights() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScoringWeights(0.5, -0.1, 0.2, 0.1, 0.15, 0.2, 0.2, 1.0));
        assertThrows(IllegalArgumentException.class,
                () -> new ScoringWeights(0.5, 0.4, 0.2, 0.1, 0.15, 0.2, 0.2, 1.5));
    }
}
