package com.entity.linking.batch;

import com.entity.linking.core.model.CandidateEntity;

import java.util.List;
import java.util.Objects;

/**
 * Unranked candidates found for one canonical name across the searched knowledge bases.
 */
public record CandidateLookupRow(String canonicalName, List<CandidateEntity> candidates) {

    public CandidateLookupRow {
        Objects.requireNonNull(canonicalName, "canonicalName is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    public static CandidateLookupRow empty(String canonicalName) {
        return new CandidateLookupRow(canonicalName, List.of());
    }
}
