package com.entity.linking.batch;

import com.entity.linking.core.model.BatchRow;

import java.util.List;

/**
 * Reconciled batch output: one row per input pair, in input order.
 * Error rows are flagged, never removed.
 */
public record ReconciliationResult(List<BatchRow> rows) {

    public ReconciliationResult {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    /**
     * Rows missing a canonical name or a knowledge base URI.
     */
    public List<BatchRow> errorRows() {
        return rows.stream().filter(BatchRow::isErrorOrAmbiguous).toList();
    }

    public int errorCount() {
        return (int) rows.stream().filter(BatchRow::isErrorOrAmbiguous).count();
    }

    public int size() {
        return rows.size();
    }
}
