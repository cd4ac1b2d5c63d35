package com.entity.linking.batch;

import java.util.List;

/**
 * One chunked step of the batch pipeline.
 *
 * <p>A stage turns a chunk of items into result rows with a single aggregated external call.
 * The reply may be incomplete or contain rows nobody asked for; {@link BatchCoordinator}
 * matches rows back to items through the key, fills gaps with {@link #placeholder} rows
 * and drops the extras.</p>
 *
 * @param <I> input item type
 * @param <K> key shared by an item and its result row
 * @param <R> result row type
 */
public interface BatchStage<I, K, R> {

    /**
     * Stage name, used as metric tag and in log messages.
     */
    String name();

    K keyOf(I item);

    K resultKey(R result);

    /**
     * Processes one chunk with one external call.
     * Any exception fails the whole chunk; every item of it then gets its placeholder.
     */
    List<R> process(List<I> chunk) throws Exception;

    /**
     * Row emitted for an item that has no usable result.
     */
    R placeholder(I item);

    /**
     * Returns false for items that are never sent and always receive their placeholder.
     */
    default boolean isProcessable(I item) {
        return true;
    }
}
