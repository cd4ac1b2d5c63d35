package com.entity.linking.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Which text generation provider produced a linking result and which knowledge bases were searched.
 */
public record LinkingProvenance(String providerName, List<String> knowledgeBasesSearched) {

    public LinkingProvenance {
        Objects.requireNonNull(providerName, "providerName is required");
        knowledgeBasesSearched = knowledgeBasesSearched != null ? List.copyOf(knowledgeBasesSearched) : List.of();
    }
}
