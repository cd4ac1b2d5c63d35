package com.entity.linking.bulk;

/**
 * Receives progress of batch stages and of tabular import and export.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed items handled so far
     * @param total     total items, or -1 while still unknown (streaming import)
     * @param message   human readable status
     */
    void onProgress(long processed, long total, String message);

    /**
     * Reports that one chunk of a batch stage has completed.
     *
     * @param chunk 1-based chunk number
     */
    default void onChunkCompleted(String stage, int chunk, int chunkCount, long processed, long total) {
        onProgress(processed, total, String.format("%s: completed chunk %d/%d", stage, chunk, chunkCount));
    }

    ProgressCallback NOOP = (processed, total, message) -> {};
}
