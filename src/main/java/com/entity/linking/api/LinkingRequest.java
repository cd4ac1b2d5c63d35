package com.entity.linking.api;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@link LinkingEngine#batchLink} call.
 * Null knowledge bases, provider or limit fall back to the engine's defaults.
 */
public record LinkingRequest(
        String mention,
        String context,
        List<String> knowledgeBases,
        String provider,
        Integer limit
) {
    public LinkingRequest {
        Objects.requireNonNull(mention, "mention is required");
        knowledgeBases = knowledgeBases != null ? List.copyOf(knowledgeBases) : null;
    }

    public static LinkingRequest of(String mention) {
        return new LinkingRequest(mention, null, null, null, null);
    }

    public static LinkingRequest of(String mention, String context) {
        return new LinkingRequest(mention, context, null, null, null);
    }

    LinkingOptions applyTo(LinkingOptions defaults) {
        return defaults.withOverrides(limit, knowledgeBases, provider);
    }
}
