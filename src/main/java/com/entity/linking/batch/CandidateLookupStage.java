package com.entity.linking.batch;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.kb.CandidateSource;
import com.entity.linking.kb.KnowledgeBaseException;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch candidate lookup: one aggregated {@link CandidateSource#lookup} per knowledge base per chunk.
 * A failing knowledge base is skipped; the chunk fails only when every knowledge base fails.
 */
public class CandidateLookupStage implements BatchStage<String, String, CandidateLookupRow> {
    private static final Logger log = LoggerFactory.getLogger(CandidateLookupStage.class);

    public static final String NAME = "candidate_lookup";

    private final List<CandidateSource> sources;
    private final int limitPerLabel;
    private final MetricsService metricsService;

    public CandidateLookupStage(List<CandidateSource> sources, int limitPerLabel) {
        this(sources, limitPerLabel, new NoOpMetricsService());
    }

    public CandidateLookupStage(List<CandidateSource> sources, int limitPerLabel, MetricsService metricsService) {
        if (limitPerLabel < 1) {
            throw new IllegalArgumentException("limitPerLabel must be at least 1, got " + limitPerLabel);
        }
        this.sources = List.copyOf(sources);
        this.limitPerLabel = limitPerLabel;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String keyOf(String canonicalName) {
        return canonicalName;
    }

    @Override
    public String resultKey(CandidateLookupRow result) {
        return result.canonicalName();
    }

    @Override
    public CandidateLookupRow placeholder(String canonicalName) {
        return CandidateLookupRow.empty(canonicalName);
    }

    @Override
    public List<CandidateLookupRow> process(List<String> canonicalNames) {
        Map<String, List<CandidateEntity>> merged = new LinkedHashMap<>();
        for (String name : canonicalNames) {
            merged.put(name, new ArrayList<>());
        }

        RuntimeException lastFailure = null;
        int failures = 0;
        for (CandidateSource source : sources) {
            try {
                Map<String, List<CandidateEntity>> found = source.lookup(canonicalNames, limitPerLabel);
                found.forEach((name, candidates) -> {
                    List<CandidateEntity> target = merged.get(name);
                    if (target != null && candidates != null) {
                        target.addAll(candidates);
                    }
                });
            } catch (RuntimeException e) {
                failures++;
                lastFailure = e;
                log.warn("kb.lookup.failed knowledgeBase={} labels={} error={}",
                        source.getName(), canonicalNames.size(), e.getMessage());
                metricsService.incrementKnowledgeBaseFailure(source.getName());
            }
        }

        if (!sources.isEmpty() && failures == sources.size()) {
            throw new KnowledgeBaseException("All knowledge bases failed for chunk", lastFailure);
        }

        List<CandidateLookupRow> rows = new ArrayList<>(merged.size());
        merged.forEach((name, candidates) -> rows.add(new CandidateLookupRow(name, candidates)));
        return rows;
    }
}
