package com.entity.linking.api;

import java.util.List;

/**
 * Options for a linking call: candidate limit, knowledge bases to search and provider to use.
 */
public class LinkingOptions {

    private static final int DEFAULT_LIMIT = 5;

    private final int limit;
    private final List<String> knowledgeBases;
    private final String provider;

    private LinkingOptions(Builder builder) {
        this.limit = builder.limit;
        this.knowledgeBases = builder.knowledgeBases;
        this.provider = builder.provider;
    }

    /**
     * Maximum number of ranked candidates returned, also passed to each knowledge base.
     */
    public int getLimit() {
        return limit;
    }

    /**
     * Knowledge bases to search; empty means every registered one.
     */
    public List<String> getKnowledgeBases() {
        return knowledgeBases;
    }

    /**
     * Text generation provider name, or null for the first registered provider.
     */
    public String getProvider() {
        return provider;
    }

    /**
     * Returns a copy with the non-null overrides applied.
     */
    public LinkingOptions withOverrides(Integer limit, List<String> knowledgeBases, String provider) {
        Builder builder = toBuilder();
        if (limit != null) {
            builder.limit(limit);
        }
        if (knowledgeBases != null) {
            builder.knowledgeBases(knowledgeBases);
        }
        if (provider != null) {
            builder.provider(provider);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        return builder()
                .limit(limit)
                .knowledgeBases(knowledgeBases)
                .provider(provider);
    }

    public static LinkingOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options restricted to the given knowledge bases.
     */
    public static LinkingOptions forKnowledgeBases(String... knowledgeBases) {
        return builder().knowledgeBases(List.of(knowledgeBases)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "LinkingOptions{limit=" + limit + ", knowledgeBases=" + knowledgeBases +
                ", provider=" + provider + '}';
    }

    public static class Builder {
        private int limit = DEFAULT_LIMIT;
        private List<String> knowledgeBases = List.of();
        private String provider;

        public Builder limit(int limit) {
            if (limit < 1) {
                throw new IllegalArgumentException("limit must be at least 1, got " + limit);
            }
            this.limit = limit;
            return this;
        }

        public Builder knowledgeBases(List<String> knowledgeBases) {
            this.knowledgeBases = knowledgeBases != null ? List.copyOf(knowledgeBases) : List.of();
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public LinkingOptions build() {
            return new LinkingOptions(this);
        }
    }
}
