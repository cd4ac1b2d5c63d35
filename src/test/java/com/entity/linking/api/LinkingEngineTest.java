package com.entity.linking.api;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityCategory;
import com.entity.linking.core.model.LinkingResult;
import com.entity.linking.core.model.ScoredCandidate;
import com.entity.linking.kb.CandidateSource;
import com.entity.linking.kb.InMemoryCandidateSource;
import com.entity.linking.llm.ScriptedTextGenerationClient;
import com.entity.linking.llm.TextGenerationException;
import com.entity.linking.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LinkingEngine Tests")
class LinkingEngineTest {

    private static final String COMPANY_ANALYSIS = """
            {"entity_type": "company", "confidence": 0.9,
             "keywords": ["technology"], "description": "Technology company"}
            """;

    private static final CandidateEntity APPLE_INC = CandidateEntity.builder()
            .identifier("KB:Apple_Inc").label("Apple Inc.").rawType("Organisation")
            .rawDescription("Apple Inc. is a technology company").build();

    private static final CandidateEntity APPLE_FRUIT = CandidateEntity.builder()
            .identifier("KB:Apple_fruit").label("Apple").rawType("Food")
            .rawDescription("The apple is an edible fruit").build();

    private final CandidateSource kb = InMemoryCandidateSource.builder("KB")
            .add("Apple", APPLE_FRUIT)
            .add("Apple", APPLE_INC)
            .build();

    /**
     * Replies with the canonical name to normalization prompts and with the analysis otherwise.
     */
    private static ScriptedTextGenerationClient llm(String canonicalName, String analysis) {
        return new ScriptedTextGenerationClient("Stub", prompt ->
                prompt.startsWith("Given the following entity mention") ? canonicalName : analysis);
    }

    private LinkingEngine engine(ScriptedTextGenerationClient client, CandidateSource... sources) {
        LinkingEngine.Builder builder = LinkingEngine.builder().textGenerationClient(client);
        for (CandidateSource source : sources) {
            builder.candidateSource(source);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("Single mention")
    class LinkTests {

        @Test
        @DisplayName("Company context ranks the organisation first")
        void linksWithContext() {
            LinkingResult result = engine(llm("Apple", COMPANY_ANALYSIS), kb).link("apple", "I work at apple");

            assertEquals("Apple", result.canonicalName());
            assertEquals(EntityCategory.COMPANY, result.getContextSignal().orElseThrow().entityType());
            assertEquals("KB:Apple_Inc", result.topCandidate().orElseThrow().identifier());
            assertEquals(2, result.rankedCandidates().size());
            assertEquals("Stub", result.provenance().providerName());
            assertEquals(List.of("KB"), result.provenance().knowledgeBasesSearched());
        }

        @Test
        @DisplayName("Without context no classification call is made and scores are the base score")
        void linksWithoutContext() {
            ScriptedTextGenerationClient client = llm("Apple", COMPANY_ANALYSIS);
            LinkingResult result = engine(client, kb).link("apple");

            assertEquals(1, client.getCallCount());
            assertTrue(result.getContextSignal().isEmpty());
            for (ScoredCandidate candidate : result.rankedCandidates()) {
                assertEquals(0.5, candidate.score());
            }
            assertEquals(0.5, result.overallConfidence(), 1e-9);
            // ties keep knowledge base order
            assertEquals("KB:Apple_fruit", result.topCandidate().orElseThrow().identifier());
        }

        @Test
        @DisplayName("Unparseable analysis degrades to the default signal")
        void notJsonAtAll() {
            LinkingResult result = engine(llm("Apple", "not json at all"), kb).link("apple", "some context");

            ContextSignal signal = result.getContextSignal().orElseThrow();
            assertEquals(EntityCategory.OTHER, signal.entityType());
            assertEquals(0.5, signal.confidence());
            assertTrue(result.hasCandidates());
        }

        @Test
        @DisplayName("Limit truncates the ranked candidates")
        void limit() {
            LinkingResult result = engine(llm("Apple", COMPANY_ANALYSIS), kb)
                    .link("apple", "I work at apple", LinkingOptions.builder().limit(1).build());
            assertEquals(1, result.rankedCandidates().size());
        }

        @Test
        @DisplayName("No candidates gives zero overall confidence")
        void noCandidates() {
            LinkingResult result = engine(llm("Atlantis", COMPANY_ANALYSIS), kb).link("atlantis", "ctx");
            assertFalse(result.hasCandidates());
            assertEquals(0.0, result.overallConfidence());
        }

        @Test
        @DisplayName("Overall confidence averages mean score and signal confidence")
        void overallConfidence() {
            ContextSignal signal = new ContextSignal(EntityCategory.OTHER, 0.6, List.of(), "x");
            List<ScoredCandidate> ranked = List.of(
                    new ScoredCandidate(APPLE_INC, 1.0), new ScoredCandidate(APPLE_FRUIT, 0.6));
            assertEquals(0.7, LinkingEngine.aggregateConfidence(ranked, signal), 1e-9);
            assertEquals(0.8, LinkingEngine.aggregateConfidence(ranked, null), 1e-9);
            assertEquals(0.0, LinkingEngine.aggregateConfidence(List.of(), signal));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("Unexpected exception from the analysis call degrades to the error signal")
        void analysisProviderBug() {
            ScriptedTextGenerationClient client = new ScriptedTextGenerationClient("Stub", prompt -> {
                if (prompt.startsWith("Given the following entity mention")) {
                    return "Apple";
                }
                throw new IllegalStateException("provider bug");
            });

            LinkingResult result = engine(client, kb).link("Apple", "I work at Apple");

            assertEquals(ContextSignal.analysisError(), result.getContextSignal().orElseThrow());
            assertEquals("Apple", result.canonicalName());
            assertEquals(2, result.rankedCandidates().size());
        }

        @Test
        @DisplayName("Normalization failure propagates")
        void normalizationFailure() {
            LinkingEngine engine = engine(ScriptedTextGenerationClient.failing("quota exceeded"), kb);
            assertThrows(TextGenerationException.class, () -> engine.link("apple", "ctx"));
        }

        @Test
        @DisplayName("A throwing knowledge base contributes no candidates")
        void failingKnowledgeBase() {
            CandidateSource broken = new CandidateSource() {
                @Override
                public String getName() {
                    return "Broken";
                }

                @Override
                public List<CandidateEntity> search(String label, ContextSignal signal, int limit) {
                    throw new IllegalStateException("boom");
                }
            };
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            LinkingEngine engine = LinkingEngine.builder()
                    .textGenerationClient(llm("Apple", COMPANY_ANALYSIS))
                    .candidateSource(broken)
                    .candidateSource(kb)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();

            LinkingResult result = engine.link("apple", "I work at apple");

            assertEquals(2, result.rankedCandidates().size());
            assertEquals(1.0, registry.find("entity.kb.search.failed")
                    .tag("knowledgeBase", "Broken").counter().count());
        }

        @Test
        @DisplayName("No registered provider fails with no providers available")
        void noProvider() {
            LinkingEngine engine = LinkingEngine.builder().candidateSource(kb).build();
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> engine.link("apple"));
            assertEquals("No text generation providers available", e.getMessage());
        }

        @Test
        @DisplayName("Unknown provider name is rejected")
        void unknownProvider() {
            LinkingEngine engine = engine(llm("Apple", COMPANY_ANALYSIS), kb);
            assertThrows(IllegalArgumentException.class, () -> engine.link("apple", null,
                    LinkingOptions.builder().provider("claude").build()));
        }

        @Test
        @DisplayName("Blank mention is rejected")
        void blankMention() {
            LinkingEngine engine = engine(llm("Apple", COMPANY_ANALYSIS), kb);
            assertThrows(IllegalArgumentException.class, () -> engine.link("  "));
        }
    }

    @Nested
    @DisplayName("Providers and knowledge bases")
    class SelectionTests {

        @Test
        @DisplayName("Named provider is used for the call")
        void namedProvider() {
            ScriptedTextGenerationClient first = llm("Apple", COMPANY_ANALYSIS);
            ScriptedTextGenerationClient second = llm("Apple", COMPANY_ANALYSIS);
            LinkingEngine engine = LinkingEngine.builder()
                    .textGenerationClient("first", first)
                    .textGenerationClient("second", second)
                    .candidateSource(kb)
                    .build();

            LinkingResult result = engine.link("apple", null, LinkingOptions.builder().provider("second").build());

            assertEquals(0, first.getCallCount());
            assertEquals(1, second.getCallCount());
            assertEquals("Stub", result.provenance().providerName());
        }

        @Test
        @DisplayName("Explicit knowledge base selection restricts the search")
        void explicitKnowledgeBases() {
            CandidateSource other = InMemoryCandidateSource.builder("Other")
                    .add("Apple", CandidateEntity.of("O:Apple", "Apple"))
                    .build();
            LinkingEngine engine = engine(llm("Apple", COMPANY_ANALYSIS), kb, other);

            LinkingResult all = engine.link("apple");
            LinkingResult onlyOther = engine.link("apple", null, LinkingOptions.forKnowledgeBases("Other"));

            assertEquals(3, all.rankedCandidates().size());
            assertEquals(List.of("KB", "Other"), all.provenance().knowledgeBasesSearched());
            assertEquals(List.of("O:Apple"),
                    onlyOther.rankedCandidates().stream().map(ScoredCandidate::identifier).toList());
            assertEquals(List.of("Other"), onlyOther.provenance().knowledgeBasesSearched());
        }

        @Test
        @DisplayName("Entity info is fetched from the named knowledge base")
        void entityInfo() {
            LinkingEngine engine = engine(llm("Apple", COMPANY_ANALYSIS), kb);
            Optional<Map<String, List<String>>> info = engine.getEntityInfo("KB", "KB:Apple_Inc");
            assertEquals(List.of("Organisation"), info.orElseThrow().get("type"));
            assertThrows(IllegalArgumentException.class, () -> engine.getEntityInfo("Nope", "x"));
        }
    }

    @Test
    @DisplayName("Batch link processes each request independently and in order")
    void batchLink() {
        ScriptedTextGenerationClient client = llm("Apple", COMPANY_ANALYSIS);
        LinkingEngine engine = engine(client, kb);

        List<LinkingResult> results = engine.batchLink(List.of(
                LinkingRequest.of("apple", "I work at apple"),
                LinkingRequest.of("apple"),
                new LinkingRequest("apple", null, null, null, 1)));

        assertEquals(3, results.size());
        assertTrue(results.get(0).getContextSignal().isPresent());
        assertTrue(results.get(1).getContextSignal().isEmpty());
        assertEquals(1, results.get(2).rankedCandidates().size());
        assertEquals(4, client.getCallCount());
    }
}
