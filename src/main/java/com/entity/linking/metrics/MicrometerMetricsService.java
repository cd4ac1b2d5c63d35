package com.entity.linking.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code entity.linking.duration} - Timer</li>
 *   <li>{@code entity.linking.confidence} - DistributionSummary</li>
 *   <li>{@code entity.candidate.score} - DistributionSummary</li>
 *   <li>{@code entity.batch.size} - DistributionSummary</li>
 *   <li>{@code entity.batch.chunk.failed} - Counter (tag: stage)</li>
 *   <li>{@code entity.batch.coverage.gap} - Counter (tag: stage)</li>
 *   <li>{@code entity.kb.search.failed} - Counter (tag: knowledgeBase)</li>
 *   <li>{@code entity.context.fallback} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer linkingTimer;
    private final DistributionSummary confidenceSummary;
    private final DistributionSummary candidateScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter contextFallbackCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.linkingTimer = Timer.builder("entity.linking.duration")
                .description("Duration of single-mention linking operations")
                .register(registry);
        this.confidenceSummary = DistributionSummary.builder("entity.linking.confidence")
                .description("Distribution of overall linking confidence")
                .register(registry);
        this.candidateScoreSummary = DistributionSummary.builder("entity.candidate.score")
                .description("Distribution of candidate context scores")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("entity.batch.size")
                .description("Distribution of batch pipeline input sizes")
                .register(registry);
        this.contextFallbackCounter = Counter.builder("entity.context.fallback")
                .description("Number of context classifications answered with a default signal")
                .register(registry);
    }

    @Override
    public void recordLinkingDuration(Duration duration) {
        linkingTimer.record(duration);
    }

    @Override
    public void recordOverallConfidence(double confidence) {
        confidenceSummary.record(confidence);
    }

    @Override
    public void recordCandidateScore(double score) {
        candidateScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementChunkFailure(String stage) {
        counter("entity.batch.chunk.failed", "stage", stage,
                "Number of batch chunks whose external call failed").increment();
    }

    @Override
    public void incrementCoverageGap(String stage, int missingItems) {
        counter("entity.batch.coverage.gap", "stage", stage,
                "Number of submitted items missing from an external reply").increment(missingItems);
    }

    @Override
    public void incrementKnowledgeBaseFailure(String knowledgeBase) {
        counter("entity.kb.search.failed", "knowledgeBase", knowledgeBase,
                "Number of failed knowledge base searches").increment();
    }

    @Override
    public void incrementContextFallback() {
        contextFallbackCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
