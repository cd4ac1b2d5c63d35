package com.entity.linking.kb;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory knowledge base keyed by case-insensitive label.
 * Useful for offline linking against a fixed vocabulary and for tests.
 *
 * <pre>
 * CandidateSource kb = InMemoryCandidateSource.builder("Local")
 *     .add("Apple", CandidateEntity.builder().identifier("KB:Apple_Inc").rawType("Organisation").build())
 *     .build();
 * </pre>
 */
public class InMemoryCandidateSource implements CandidateSource {

    private final String name;
    private final Map<String, List<CandidateEntity>> candidatesByLabel;

    private InMemoryCandidateSource(Builder builder) {
        this.name = builder.name;
        Map<String, List<CandidateEntity>> copy = new LinkedHashMap<>();
        builder.candidatesByLabel.forEach((label, candidates) -> copy.put(label, List.copyOf(candidates)));
        this.candidatesByLabel = Collections.unmodifiableMap(copy);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<CandidateEntity> search(String label, ContextSignal contextSignal, int limit) {
        if (label == null) {
            return List.of();
        }
        List<CandidateEntity> candidates = candidatesByLabel.getOrDefault(key(label), List.of());
        return candidates.size() > limit ? candidates.subList(0, limit) : candidates;
    }

    @Override
    public Optional<Map<String, List<String>>> getEntityInfo(String identifier) {
        for (List<CandidateEntity> candidates : candidatesByLabel.values()) {
            for (CandidateEntity candidate : candidates) {
                if (candidate.identifier().equals(identifier)) {
                    Map<String, List<String>> info = new LinkedHashMap<>();
                    info.put("label", List.of(candidate.label()));
                    if (candidate.rawType() != null) {
                        info.put("type", List.of(candidate.rawType()));
                    }
                    if (candidate.rawDescription() != null) {
                        info.put("description", List.of(candidate.rawDescription()));
                    }
                    return Optional.of(info);
                }
            }
        }
        return Optional.empty();
    }

    private static String key(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private final Map<String, List<CandidateEntity>> candidatesByLabel = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name is required");
        }

        /**
         * Adds a candidate for a label. Candidates keep insertion order per label.
         */
        public Builder add(String label, CandidateEntity candidate) {
            Objects.requireNonNull(label, "label is required");
            Objects.requireNonNull(candidate, "candidate is required");
            CandidateEntity owned = candidate.knowledgeBase() != null ? candidate
                    : new CandidateEntity(candidate.identifier(), candidate.label(),
                    candidate.rawType(), candidate.rawDescription(), name);
            candidatesByLabel.computeIfAbsent(key(label), k -> new ArrayList<>()).add(owned);
            return this;
        }

        public InMemoryCandidateSource build() {
            return new InMemoryCandidateSource(this);
        }
    }
}
