package com.entity.linking.metrics;

import java.time.Duration;

/**
 * Interface for recording entity linking metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordLinkingDuration(Duration duration);

    void recordOverallConfidence(double confidence);

    void recordCandidateScore(double score);

    void recordBatchSize(int size);

    void incrementChunkFailure(String stage);

    void incrementCoverageGap(String stage, int missingItems);

    void incrementKnowledgeBaseFailure(String knowledgeBase);

    void incrementContextFallback();
}
