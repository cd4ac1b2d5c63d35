package com.entity.linking.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLinkingDuration(Duration duration) {
    }

    @Override
    public void recordOverallConfidence(double confidence) {
    }

    @Override
    public void recordCandidateScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementChunkFailure(String stage) {
    }

    @Override
    public void incrementCoverageGap(String stage, int missingItems) {
    }

    @Override
    public void incrementKnowledgeBaseFailure(String knowledgeBase) {
    }

    @Override
    public void incrementContextFallback() {
    }
}
