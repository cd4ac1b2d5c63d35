package com.entity.linking.batch;

import java.util.List;

/**
 * Options for {@link BatchLinkingPipeline}: chunk size per stage, candidate limit,
 * chunk concurrency, knowledge bases and provider.
 */
public class BatchOptions {

    public static final int DEFAULT_CANONICAL_CHUNK_SIZE = 20;
    public static final int DEFAULT_CONTEXT_CHUNK_SIZE = 10;
    public static final int DEFAULT_LOOKUP_CHUNK_SIZE = 5;
    public static final int DEFAULT_CANDIDATE_LIMIT = 5;

    private final int canonicalChunkSize;
    private final int contextChunkSize;
    private final int lookupChunkSize;
    private final int candidateLimit;
    private final int parallelism;
    private final List<String> knowledgeBases;
    private final String provider;

    private BatchOptions(Builder builder) {
        this.canonicalChunkSize = builder.canonicalChunkSize;
        this.contextChunkSize = builder.contextChunkSize;
        this.lookupChunkSize = builder.lookupChunkSize;
        this.candidateLimit = builder.candidateLimit;
        this.parallelism = builder.parallelism;
        this.knowledgeBases = builder.knowledgeBases;
        this.provider = builder.provider;
    }

    public int getCanonicalChunkSize() {
        return canonicalChunkSize;
    }

    public int getContextChunkSize() {
        return contextChunkSize;
    }

    public int getLookupChunkSize() {
        return lookupChunkSize;
    }

    public int getCandidateLimit() {
        return candidateLimit;
    }

    /**
     * Maximum number of chunks in flight at once; 1 runs chunks sequentially.
     */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * Knowledge bases to search; empty means every registered one.
     */
    public List<String> getKnowledgeBases() {
        return knowledgeBases;
    }

    public String getProvider() {
        return provider;
    }

    public static BatchOptions defaults() {
        return builder().build();
    }

    /**
     * Same chunk size for all three stages.
     */
    public static BatchOptions uniformChunkSize(int chunkSize) {
        return builder()
                .canonicalChunkSize(chunkSize)
                .contextChunkSize(chunkSize)
                .lookupChunkSize(chunkSize)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "BatchOptions{canonicalChunkSize=" + canonicalChunkSize +
                ", contextChunkSize=" + contextChunkSize +
                ", lookupChunkSize=" + lookupChunkSize +
                ", candidateLimit=" + candidateLimit +
                ", parallelism=" + parallelism +
                ", knowledgeBases=" + knowledgeBases +
                ", provider=" + provider + '}';
    }

    public static class Builder {
        private int canonicalChunkSize = DEFAULT_CANONICAL_CHUNK_SIZE;
        private int contextChunkSize = DEFAULT_CONTEXT_CHUNK_SIZE;
        private int lookupChunkSize = DEFAULT_LOOKUP_CHUNK_SIZE;
        private int candidateLimit = DEFAULT_CANDIDATE_LIMIT;
        private int parallelism = 1;
        private List<String> knowledgeBases = List.of();
        private String provider;

        public Builder canonicalChunkSize(int canonicalChunkSize) {
            this.canonicalChunkSize = requirePositive("canonicalChunkSize", canonicalChunkSize);
            return this;
        }

        public Builder contextChunkSize(int contextChunkSize) {
            this.contextChunkSize = requirePositive("contextChunkSize", contextChunkSize);
            return this;
        }

        public Builder lookupChunkSize(int lookupChunkSize) {
            this.lookupChunkSize = requirePositive("lookupChunkSize", lookupChunkSize);
            return this;
        }

        public Builder candidateLimit(int candidateLimit) {
            this.candidateLimit = requirePositive("candidateLimit", candidateLimit);
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = requirePositive("parallelism", parallelism);
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

        public BatchOptions build() {
            return new BatchOptions(this);
        }

        private static int requirePositive(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be at least 1, got " + value);
            }
            return value;
        }
    }
}
