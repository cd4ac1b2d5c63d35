package com.entity.linking.kb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name to source map of the knowledge bases an engine can search.
 * Populated once at construction and read-only afterwards.
 */
public final class KnowledgeBaseRegistry {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseRegistry.class);

    private final Map<String, CandidateSource> sources;

    private KnowledgeBaseRegistry(Map<String, CandidateSource> sources) {
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    public static KnowledgeBaseRegistry of(Map<String, CandidateSource> sources) {
        Objects.requireNonNull(sources, "sources is required");
        return new KnowledgeBaseRegistry(sources);
    }

    /**
     * Creates a registry keyed by each source's own name.
     */
    public static KnowledgeBaseRegistry of(List<? extends CandidateSource> sources) {
        Map<String, CandidateSource> byName = new LinkedHashMap<>();
        for (CandidateSource source : sources) {
            byName.put(source.getName(), source);
        }
        return new KnowledgeBaseRegistry(byName);
    }

    public Optional<CandidateSource> get(String name) {
        return Optional.ofNullable(sources.get(name));
    }

    /**
     * Registered names in registration order.
     */
    public List<String> names() {
        return List.copyOf(sources.keySet());
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    /**
     * Selects the sources to search.
     *
     * @param names requested knowledge base names; null or empty selects every registered source
     * @return the selected sources in request order; unknown names are logged and skipped
     */
    public List<CandidateSource> select(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.copyOf(sources.values());
        }
        List<CandidateSource> selected = new ArrayList<>();
        for (String name : names) {
            CandidateSource source = sources.get(name);
            if (source == null) {
                log.warn("Unknown knowledge base '{}' requested, skipping (available: {})",
                        name, sources.keySet());
                continue;
            }
            selected.add(source);
        }
        return selected;
    }
}
