package com.entity.linking.api;

import com.entity.linking.analysis.ContextClassifier;
import com.entity.linking.analysis.NameNormalizer;
import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityMention;
import com.entity.linking.core.model.LinkingProvenance;
import com.entity.linking.core.model.LinkingResult;
import com.entity.linking.core.model.ScoredCandidate;
import com.entity.linking.json.TolerantJsonParser;
import com.entity.linking.kb.CandidateSource;
import com.entity.linking.kb.InputSanitizer;
import com.entity.linking.kb.KnowledgeBaseRegistry;
import com.entity.linking.llm.TextGenerationClient;
import com.entity.linking.llm.TextGenerationRegistry;
import com.entity.linking.logging.LogContext;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.entity.linking.scoring.CandidateScorer;
import com.entity.linking.scoring.ScoringWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Main entry point for linking entity mentions to knowledge base identifiers.
 *
 * <p>Each mention goes through five stages, always in this order:</p>
 * <ol>
 *   <li>NORMALIZE: the text generation provider returns the canonical name (failures propagate)</li>
 *   <li>CLASSIFY: only when context is present, the provider classifies it into a signal</li>
 *   <li>SEARCH: every selected knowledge base is searched; a failing one contributes nothing</li>
 *   <li>SCORE &amp; RANK: all candidates are scored against the signal and truncated to the limit</li>
 *   <li>AGGREGATE: overall confidence from the ranked scores and the signal confidence</li>
 * </ol>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * LinkingEngine engine = LinkingEngine.builder()
 *     .textGenerationClient(new GeminiTextGenerationClient(config))
 *     .candidateSource(new DBpediaCandidateSource())
 *     .build();
 *
 * LinkingResult result = engine.link("apple", "I work at apple");
 * result.topCandidate().ifPresent(c -&gt; System.out.println(c.identifier()));
 * </pre>
 *
 * Registries are fixed at build time, so one engine can be shared between threads.
 */
public class LinkingEngine {
    private static final Logger log = LoggerFactory.getLogger(LinkingEngine.class);

    private final TextGenerationRegistry textGenerationRegistry;
    private final KnowledgeBaseRegistry knowledgeBaseRegistry;
    private final CandidateScorer scorer;
    private final TolerantJsonParser parser;
    private final MetricsService metricsService;
    private final LinkingOptions defaultOptions;

    private LinkingEngine(Builder builder) {
        this.textGenerationRegistry = TextGenerationRegistry.of(builder.clients);
        this.knowledgeBaseRegistry = KnowledgeBaseRegistry.of(builder.sources);
        this.scorer = new CandidateScorer(builder.scoringWeights);
        this.parser = new TolerantJsonParser();
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.defaultOptions = builder.options != null ? builder.options : LinkingOptions.defaults();

        log.info("LinkingEngine initialized: providers={}, knowledgeBases={}, options={}",
                textGenerationRegistry.names(), knowledgeBaseRegistry.names(), defaultOptions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public LinkingResult link(String mention) {
        return link(mention, null, defaultOptions);
    }

    public LinkingResult link(String mention, String context) {
        return link(mention, context, defaultOptions);
    }

    /**
     * Links one mention.
     *
     * @param mention non-blank mention
     * @param context optional surrounding text
     * @param options call options, or null for the engine defaults
     * @throws com.entity.linking.llm.TextGenerationException if name normalization fails
     * @throws IllegalArgumentException if the mention or the provider name is invalid
     * @throws IllegalStateException    if no text generation provider is registered
     */
    public LinkingResult link(String mention, String context, LinkingOptions options) {
        InputSanitizer.validateMention(mention);
        LinkingOptions opts = options != null ? options : defaultOptions;
        TextGenerationClient provider = textGenerationRegistry.resolve(opts.getProvider());
        long startNanos = System.nanoTime();

        try (LogContext logCtx = LogContext.forLinking(LogContext.generateCorrelationId(), mention)) {
            String canonicalName = new NameNormalizer(provider).normalize(mention, context);

            ContextSignal contextSignal = null;
            if (context != null && !context.isBlank()) {
                contextSignal = new ContextClassifier(provider, parser, metricsService)
                        .classify(mention, context);
            }

            List<CandidateEntity> candidates = new ArrayList<>();
            for (CandidateSource source : knowledgeBaseRegistry.select(opts.getKnowledgeBases())) {
                candidates.addAll(searchIsolated(source, canonicalName, contextSignal, opts.getLimit()));
            }

            List<ScoredCandidate> ranked = scorer.rank(candidates, contextSignal, opts.getLimit());
            for (ScoredCandidate candidate : ranked) {
                metricsService.recordCandidateScore(candidate.score());
            }

            double confidence = aggregateConfidence(ranked, contextSignal);
            List<String> searched = opts.getKnowledgeBases().isEmpty()
                    ? knowledgeBaseRegistry.names() : opts.getKnowledgeBases();

            LinkingResult result = new LinkingResult(
                    new EntityMention(mention, context),
                    canonicalName,
                    contextSignal,
                    ranked,
                    confidence,
                    new LinkingProvenance(provider.getName(), searched));

            metricsService.recordLinkingDuration(Duration.ofNanos(System.nanoTime() - startNanos));
            metricsService.recordOverallConfidence(confidence);
            log.info("entity.linked canonicalName='{}' candidates={} top={} confidence={}",
                    canonicalName, ranked.size(),
                    result.topCandidate().map(ScoredCandidate::identifier).orElse(null), confidence);
            return result;
        }
    }

    /**
     * Links each request independently, in input order.
     */
    public List<LinkingResult> batchLink(List<LinkingRequest> requests) {
        Objects.requireNonNull(requests, "requests is required");
        List<LinkingResult> results = new ArrayList<>(requests.size());
        for (LinkingRequest request : requests) {
            results.add(link(request.mention(), request.context(), request.applyTo(defaultOptions)));
        }
        log.info("batch.linked requests={}", requests.size());
        return results;
    }

    /**
     * Fetches detail properties of an identifier from a named knowledge base.
     *
     * @throws IllegalArgumentException if the knowledge base is not registered
     */
    public Optional<Map<String, List<String>>> getEntityInfo(String knowledgeBase, String identifier) {
        CandidateSource source = knowledgeBaseRegistry.get(knowledgeBase)
                .orElseThrow(() -> new IllegalArgumentException("Unknown knowledge base: " + knowledgeBase));
        return source.getEntityInfo(identifier);
    }

    /**
     * Mean of the ranked scores, averaged with the signal confidence when a signal exists.
     * Zero candidates give 0.0.
     */
    static double aggregateConfidence(List<ScoredCandidate> ranked, ContextSignal contextSignal) {
        if (ranked.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (ScoredCandidate candidate : ranked) {
            sum += candidate.score();
        }
        double average = sum / ranked.size();
        if (contextSignal != null) {
            return (average + contextSignal.confidence()) / 2;
        }
        return average;
    }

    private List<CandidateEntity> searchIsolated(CandidateSource source, String label,
                                                 ContextSignal contextSignal, int limit) {
        try {
            List<CandidateEntity> found = source.search(label, contextSignal, limit);
            return found != null ? found : List.of();
        } catch (RuntimeException e) {
            log.error("kb.search.failed knowledgeBase={} label='{}' error={}",
                    source.getName(), label, e.getMessage(), e);
            metricsService.incrementKnowledgeBaseFailure(source.getName());
            return List.of();
        }
    }

    public TextGenerationRegistry getTextGenerationRegistry() {
        return textGenerationRegistry;
    }

    public KnowledgeBaseRegistry getKnowledgeBaseRegistry() {
        return knowledgeBaseRegistry;
    }

    public CandidateScorer getScorer() {
        return scorer;
    }

    public TolerantJsonParser getParser() {
        return parser;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public LinkingOptions getDefaultOptions() {
        return defaultOptions;
    }

    public static class Builder {
        private final Map<String, TextGenerationClient> clients = new LinkedHashMap<>();
        private final Map<String, CandidateSource> sources = new LinkedHashMap<>();
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private MetricsService metricsService;
        private LinkingOptions options;

        /**
         * Registers a text generation client under its own name.
         */
        public Builder textGenerationClient(TextGenerationClient client) {
            Objects.requireNonNull(client, "client is required");
            return textGenerationClient(client.getName(), client);
        }

        public Builder textGenerationClient(String name, TextGenerationClient client) {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(client, "client is required");
            clients.put(name, client);
            return this;
        }

        /**
         * Registers a knowledge base under its own name.
         */
        public Builder candidateSource(CandidateSource source) {
            Objects.requireNonNull(source, "source is required");
            return candidateSource(source.getName(), source);
        }

        public Builder candidateSource(String name, CandidateSource source) {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(source, "source is required");
            sources.put(name, source);
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder options(LinkingOptions options) {
            this.options = options;
            return this;
        }

        public LinkingEngine build() {
            return new LinkingEngine(this);
        }
    }
}
