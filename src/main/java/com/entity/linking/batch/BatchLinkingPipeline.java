package com.entity.linking.batch;

import com.entity.linking.api.LinkingEngine;
import com.entity.linking.bulk.ProgressCallback;
import com.entity.linking.core.model.EntityMention;
import com.entity.linking.kb.CandidateSource;
import com.entity.linking.llm.TextGenerationClient;
import com.entity.linking.logging.LogContext;
import com.entity.linking.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Links a list of (mention, context) pairs with chunked calls to the text generation
 * provider and the knowledge bases.
 *
 * <ol>
 *   <li>canonical names for all mentions</li>
 *   <li>context analysis for all pairs</li>
 *   <li>candidate lookup for the distinct resolved canonical names</li>
 *   <li>reconciliation into one {@link com.entity.linking.core.model.BatchRow} per pair</li>
 * </ol>
 *
 * External failures never escape; they show up as null fields in the affected rows.
 *
 * <pre>
 * BatchLinkingPipeline pipeline = new BatchLinkingPipeline(engine);
 * ReconciliationResult result = pipeline.run(List.of(
 *         EntityMention.of("Apple", "Apple released a new iPhone"),
 *         EntityMention.of("Apple", "I ate an apple")));
 * </pre>
 */
public class BatchLinkingPipeline {
    private static final Logger log = LoggerFactory.getLogger(BatchLinkingPipeline.class);

    private final LinkingEngine engine;
    private final BatchOptions defaultOptions;
    private final ProgressCallback progressCallback;

    public BatchLinkingPipeline(LinkingEngine engine) {
        this(engine, BatchOptions.defaults(), ProgressCallback.NOOP);
    }

    public BatchLinkingPipeline(LinkingEngine engine, BatchOptions defaultOptions, ProgressCallback progressCallback) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.defaultOptions = defaultOptions != null ? defaultOptions : BatchOptions.defaults();
        this.progressCallback = progressCallback != null ? progressCallback : ProgressCallback.NOOP;
    }

    public ReconciliationResult run(List<EntityMention> pairs) {
        return run(pairs, defaultOptions);
    }

    /**
     * Runs the full pipeline.
     *
     * @throws IllegalArgumentException if the provider or options are invalid
     * @throws IllegalStateException    if no text generation provider is registered
     */
    public ReconciliationResult run(List<EntityMention> pairs, BatchOptions options) {
        Objects.requireNonNull(pairs, "pairs is required");
        BatchOptions opts = options != null ? options : defaultOptions;
        TextGenerationClient client = engine.getTextGenerationRegistry().resolve(opts.getProvider());
        List<CandidateSource> sources = engine.getKnowledgeBaseRegistry().select(opts.getKnowledgeBases());
        MetricsService metrics = engine.getMetricsService();
        BatchCoordinator coordinator = new BatchCoordinator(opts.getParallelism(), metrics, progressCallback);

        long start = System.currentTimeMillis();
        try (LogContext logCtx = LogContext.forBatch(LogContext.generateCorrelationId())) {
            log.info("batch.pipeline.started pairs={} provider={} knowledgeBases={} options={}",
                    pairs.size(), client.getName(), sources.size(), opts);

            List<String> mentions = new ArrayList<>(pairs.size());
            for (EntityMention pair : pairs) {
                mentions.add(pair.mention());
            }
            List<CanonicalNameRow> canonicalRows = coordinator.run(mentions, opts.getCanonicalChunkSize(),
                    new CanonicalNameStage(client, engine.getParser()));

            List<ContextAnalysisRow> contextRows = coordinator.run(pairs, opts.getContextChunkSize(),
                    new ContextAnalysisStage(client, engine.getParser()));

            Set<String> canonicalNames = new LinkedHashSet<>();
            for (CanonicalNameRow row : canonicalRows) {
                if (row.canonicalName() != null) {
                    canonicalNames.add(row.canonicalName());
                }
            }
            List<CandidateLookupRow> lookupRows = coordinator.run(new ArrayList<>(canonicalNames),
                    opts.getLookupChunkSize(),
                    new CandidateLookupStage(sources, opts.getCandidateLimit(), metrics));

            ReconciliationResult result = new ResultReconciler(engine.getScorer())
                    .reconcile(contextRows, canonicalRows, lookupRows);

            log.info("batch.pipeline.completed rows={} errorOrAmbiguous={} durationMs={}",
                    result.size(), result.errorCount(), System.currentTimeMillis() - start);
            return result;
        }
    }
}
