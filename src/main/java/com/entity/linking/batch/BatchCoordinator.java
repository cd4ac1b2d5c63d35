package com.entity.linking.batch;

import com.entity.linking.bulk.ProgressCallback;
import com.entity.linking.logging.LogContext;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a {@link BatchStage} over a list of items in fixed-size chunks.
 *
 * <p>Guarantees, whatever the external service replies:</p>
 * <ul>
 *   <li>every distinct input key appears exactly once in the output</li>
 *   <li>a failing chunk only affects its own items, which get placeholders</li>
 *   <li>output order is the first-occurrence order of keys in the input</li>
 * </ul>
 *
 * <p>With {@code parallelism > 1} chunks are submitted to a bounded fixed pool, one request
 * per chunk. Results are reassembled by chunk index, so the output is identical to a
 * sequential run.</p>
 */
public class BatchCoordinator {
    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final int parallelism;
    private final MetricsService metricsService;
    private final ProgressCallback progressCallback;

    public BatchCoordinator() {
        this(1, new NoOpMetricsService(), ProgressCallback.NOOP);
    }

    public BatchCoordinator(int parallelism, MetricsService metricsService, ProgressCallback progressCallback) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.progressCallback = progressCallback != null ? progressCallback : ProgressCallback.NOOP;
    }

    /**
     * Runs the stage over all items.
     *
     * @param items     input items, duplicates allowed
     * @param chunkSize maximum items per external call, at least 1
     * @return one row per distinct key, in input order
     */
    public <I, K, R> List<R> run(List<I> items, int chunkSize, BatchStage<I, K, R> stage) {
        Objects.requireNonNull(items, "items is required");
        Objects.requireNonNull(stage, "stage is required");
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, got " + chunkSize);
        }

        List<List<I>> chunks = partition(items, chunkSize);
        metricsService.recordBatchSize(items.size());
        log.info("batch.stage.started stage={} items={} chunks={} chunkSize={} parallelism={}",
                stage.name(), items.size(), chunks.size(), chunkSize, parallelism);

        List<List<R>> chunkResults = parallelism > 1 && chunks.size() > 1
                ? runParallel(chunks, stage, items.size())
                : runSequential(chunks, stage, items.size());

        Map<K, R> deduplicated = new LinkedHashMap<>();
        for (List<R> rows : chunkResults) {
            for (R row : rows) {
                deduplicated.putIfAbsent(stage.resultKey(row), row);
            }
        }

        log.info("batch.stage.completed stage={} items={} distinct={}",
                stage.name(), items.size(), deduplicated.size());
        return new ArrayList<>(deduplicated.values());
    }

    private <I, K, R> List<List<R>> runSequential(List<List<I>> chunks, BatchStage<I, K, R> stage, int total) {
        List<List<R>> results = new ArrayList<>(chunks.size());
        long processed = 0;
        for (int i = 0; i < chunks.size(); i++) {
            results.add(runChunk(stage, chunks.get(i), i, chunks.size()));
            processed += chunks.get(i).size();
            reportProgress(stage, processed, total, i, chunks.size());
        }
        return results;
    }

    private <I, K, R> List<List<R>> runParallel(List<List<I>> chunks, BatchStage<I, K, R> stage, int total) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, chunks.size()));
        try {
            List<Future<List<R>>> futures = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                final int index = i;
                futures.add(executor.submit(() -> runChunk(stage, chunks.get(index), index, chunks.size())));
            }

            List<List<R>> results = new ArrayList<>(chunks.size());
            long processed = 0;
            for (int i = 0; i < futures.size(); i++) {
                results.add(awaitChunk(futures.get(i), stage, chunks.get(i), i, chunks.size()));
                processed += chunks.get(i).size();
                reportProgress(stage, processed, total, i, chunks.size());
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private <I, K, R> List<R> awaitChunk(Future<List<R>> future, BatchStage<I, K, R> stage,
                                         List<I> chunk, int index, int chunkCount) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failChunk(stage, chunk, index, chunkCount, e);
        } catch (ExecutionException e) {
            return failChunk(stage, chunk, index, chunkCount, e.getCause() != null ? e.getCause() : e);
        }
    }

    <I, K, R> List<R> runChunk(BatchStage<I, K, R> stage, List<I> chunk, int index, int chunkCount) {
        try (LogContext logCtx = LogContext.forChunk(stage.name(), index + 1)) {
            List<I> submitted = new ArrayList<>(chunk.size());
            for (I item : chunk) {
                if (stage.isProcessable(item)) {
                    submitted.add(item);
                }
            }

            List<R> reply;
            if (submitted.isEmpty()) {
                reply = List.of();
            } else {
                log.debug("batch.chunk.started stage={} chunk={}/{} items={}",
                        stage.name(), index + 1, chunkCount, submitted.size());
                try {
                    reply = stage.process(submitted);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return failChunk(stage, chunk, index, chunkCount, e);
                } catch (Exception e) {
                    return failChunk(stage, chunk, index, chunkCount, e);
                }
            }

            return alignToItems(stage, chunk, submitted, reply, index, chunkCount);
        }
    }

    private <I, K, R> List<R> alignToItems(BatchStage<I, K, R> stage, List<I> chunk, List<I> submitted,
                                           List<R> reply, int index, int chunkCount) {
        Set<K> submittedKeys = new HashSet<>();
        for (I item : submitted) {
            submittedKeys.add(stage.keyOf(item));
        }

        Map<K, R> byKey = new HashMap<>();
        int unexpected = 0;
        if (reply != null) {
            for (R row : reply) {
                if (row == null) {
                    continue;
                }
                K key = stage.resultKey(row);
                if (submittedKeys.contains(key)) {
                    byKey.putIfAbsent(key, row);
                } else {
                    unexpected++;
                }
            }
        }
        if (unexpected > 0) {
            log.debug("batch.chunk.unexpected stage={} chunk={}/{} ignored={}",
                    stage.name(), index + 1, chunkCount, unexpected);
        }

        List<R> rows = new ArrayList<>(chunk.size());
        Set<K> missingKeys = new HashSet<>();
        for (I item : chunk) {
            K key = stage.keyOf(item);
            R row = byKey.get(key);
            if (row == null) {
                if (submittedKeys.contains(key)) {
                    missingKeys.add(key);
                }
                row = stage.placeholder(item);
            }
            rows.add(row);
        }

        if (!missingKeys.isEmpty()) {
            log.warn("batch.coverage.gap stage={} chunk={}/{} missing={}",
                    stage.name(), index + 1, chunkCount, missingKeys.size());
            metricsService.incrementCoverageGap(stage.name(), missingKeys.size());
        }
        return rows;
    }

    private <I, K, R> List<R> failChunk(BatchStage<I, K, R> stage, List<I> chunk, int index,
                                        int chunkCount, Throwable error) {
        log.error("batch.chunk.failed stage={} chunk={}/{} items={} error={}",
                stage.name(), index + 1, chunkCount, chunk.size(), error.getMessage(), error);
        metricsService.incrementChunkFailure(stage.name());
        List<R> placeholders = new ArrayList<>(chunk.size());
        for (I item : chunk) {
            placeholders.add(stage.placeholder(item));
        }
        return placeholders;
    }

    private void reportProgress(BatchStage<?, ?, ?> stage, long processed, int total, int index, int chunkCount) {
        progressCallback.onChunkCompleted(stage.name(), index + 1, chunkCount, processed, total);
    }

    static <T> List<List<T>> partition(List<T> items, int chunkSize) {
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += chunkSize) {
            chunks.add(items.subList(start, Math.min(start + chunkSize, items.size())));
        }
        return chunks;
    }

    public int getParallelism() {
        return parallelism;
    }
}
