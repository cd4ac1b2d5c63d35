package com.entity.linking.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core model Tests")
class ModelTest {

    @Nested
    @DisplayName("EntityCategory")
    class EntityCategoryTests {

        @ParameterizedTest
        @EnumSource(EntityCategory.class)
        void labelRoundTrips(EntityCategory category) {
            assertEquals(category, EntityCategory.fromLabel(category.getLabel()));
        }

        @ParameterizedTest
        @CsvSource({"Company,COMPANY", "' person ',PERSON", "PLACE,PLACE"})
        void fromLabelIsLenient(String label, EntityCategory expected) {
            assertEquals(expected, EntityCategory.fromLabel(label));
        }

        @ParameterizedTest
        @ValueSource(strings = {"organisation", "", "animal"})
        void unknownLabelsMapToOther(String label) {
            assertEquals(EntityCategory.OTHER, EntityCategory.fromLabel(label));
        }

        @Test
        void nullLabelMapsToOther() {
            assertEquals(EntityCategory.OTHER, EntityCategory.fromLabel(null));
        }
    }

    @Nested
    @DisplayName("ContextSignal")
    class ContextSignalTests {

        @ParameterizedTest
        @ValueSource(doubles = {-0.01, 1.01})
        void rejectsConfidenceOutOfRange(double confidence) {
            assertThrows(IllegalArgumentException.class,
                    () -> new ContextSignal(EntityCategory.COMPANY, confidence, List.of(), "x"));
        }

        @Test
        void nullKeywordsAndDescriptionGetDefaults() {
            ContextSignal signal = new ContextSignal(EntityCategory.PLACE, 0.7, null, null);
            assertTrue(signal.keywords().isEmpty());
            assertEquals(ContextSignal.UNKNOWN_DESCRIPTION, signal.description());
        }

        @Test
        void fallbackSignals() {
            assertTrue(ContextSignal.unknown().isFallback());
            assertTrue(ContextSignal.analysisError().isFallback());
            assertEquals("Error in analysis", ContextSignal.analysisError().description());
            assertEquals(0.5, ContextSignal.unknown().confidence());
            assertFalse(new ContextSignal(EntityCategory.OTHER, 0.5, List.of("fruit"), "A fruit").isFallback());
        }
    }

    @Nested
    @DisplayName("LinkingResult")
    class LinkingResultTests {

        private final EntityMention mention = EntityMention.of("Apple", "I ate an apple");
        private final LinkingProvenance provenance = new LinkingProvenance("Stub", List.of("KB"));

        @Test
        void rejectsUnsortedCandidates() {
            List<ScoredCandidate> unsorted = List.of(
                    new ScoredCandidate(CandidateEntity.of("KB:A", "A"), 0.5),
                    new ScoredCandidate(CandidateEntity.of("KB:B", "B"), 0.9));
            assertThrows(IllegalArgumentException.class,
                    () -> new LinkingResult(mention, "Apple", null, unsorted, 0.5, provenance));
        }

        @Test
        void rejectsConfidenceOutOfRange() {
            assertThrows(IllegalArgumentException.class,
                    () -> new LinkingResult(mention, "Apple", null, List.of(), 1.5, provenance));
        }

        @Test
        void topCandidateAndAbsentSignal() {
            ScoredCandidate best = new ScoredCandidate(CandidateEntity.of("KB:Apple_fruit", "Apple"), 0.9);
            LinkingResult result = new LinkingResult(mention, "Apple", null,
                    List.of(best, new ScoredCandidate(CandidateEntity.of("KB:Apple_Inc", "Apple Inc."), 0.6)),
                    0.75, provenance);

            assertEquals(best, result.topCandidate().orElseThrow());
            assertTrue(result.hasCandidates());
            assertTrue(result.getContextSignal().isEmpty());
        }

        @Test
        void noCandidates() {
            LinkingResult result = new LinkingResult(mention, "Apple", null, null, 0.0, provenance);
            assertTrue(result.topCandidate().isEmpty());
            assertFalse(result.hasCandidates());
        }
    }

    @Nested
    @DisplayName("Candidates")
    class CandidateTests {

        @Test
        void labelDefaultsToIdentifier() {
            assertEquals("KB:X", new CandidateEntity("KB:X", null, null, null, null).label());
        }

        @Test
        void scoreMustBeInRange() {
            CandidateEntity candidate = CandidateEntity.of("KB:X", "X");
            assertThrows(IllegalArgumentException.class, () -> new ScoredCandidate(candidate, 1.2));
            assertThrows(IllegalArgumentException.class, () -> new ScoredCandidate(candidate, -0.1));
        }
    }

    @Nested
    @DisplayName("BatchRow")
    class BatchRowTests {

        @Test
        void completeRowIsNotFlagged() {
            BatchRow row = new BatchRow("Apple", null, "Apple", EntityCategory.COMPANY, 0.9,
                    List.of(), null, "KB:Apple_Inc", 1.0);
            assertFalse(row.isErrorOrAmbiguous());
        }

        @Test
        void missingNameOrUriIsFlagged() {
            assertTrue(new BatchRow("Apple", null, null, null, null, null, null, "KB:Apple_Inc", 1.0)
                    .isErrorOrAmbiguous());
            assertTrue(new BatchRow("Apple", null, "Apple", null, null, null, null, null, null)
                    .isErrorOrAmbiguous());
        }

        @Test
        void toMentionKeepsPair() {
            BatchRow row = new BatchRow("Apple", "ctx", null, null, null, null, null, null, null);
            assertEquals(EntityMention.of("Apple", "ctx"), row.toMention());
        }
    }

    @Test
    void mentionHasContext() {
        assertTrue(EntityMention.of("Apple", "I ate an apple").hasContext());
        assertFalse(EntityMention.of("Apple", "   ").hasContext());
        assertFalse(EntityMention.of("Apple").hasContext());
    }
}
