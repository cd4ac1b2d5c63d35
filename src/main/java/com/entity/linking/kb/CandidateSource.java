package com.entity.linking.kb;

import com.entity.linking.core.model.CandidateEntity;
import com.entity.linking.core.model.ContextSignal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A knowledge base that proposes candidate entities for a label.
 * One implementation per knowledge base; scoring is done by the caller.
 */
public interface CandidateSource {

    /**
     * Returns the name this source is registered under.
     */
    String getName();

    /**
     * Searches candidates for a label.
     * Implementations must return an empty list, never throw, when the query fails,
     * so that one failing knowledge base cannot abort a linking call.
     *
     * @param label         canonical name to look up
     * @param contextSignal context classification, or null when none is available
     * @param limit         maximum number of candidates
     */
    List<CandidateEntity> search(String label, ContextSignal contextSignal, int limit);

    /**
     * Looks up candidates for many labels in one aggregated request.
     * Unlike {@link #search}, a failure is reported by throwing {@link KnowledgeBaseException}
     * so the batch layer can treat the whole chunk as failed.
     *
     * @return candidates per label; labels without a match may be absent
     */
    default Map<String, List<CandidateEntity>> lookup(List<String> labels, int limitPerLabel) {
        Map<String, List<CandidateEntity>> results = new LinkedHashMap<>();
        for (String label : labels) {
            results.put(label, search(label, null, limitPerLabel));
        }
        return results;
    }

    /**
     * Fetches detail properties for an identifier, keyed by property, for on-demand lookups.
     */
    default Optional<Map<String, List<String>>> getEntityInfo(String identifier) {
        return Optional.empty();
    }
}
