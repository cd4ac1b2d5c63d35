package com.entity.linking.bulk;

import com.entity.linking.core.model.EntityMention;

import java.util.List;

/**
 * Result of a mention import.
 *
 * @param totalRecords number of data records read, skipped ones included
 * @param mentions     mentions read, in input order
 * @param errors       records that were skipped, with the reason
 */
public record ImportResult(
        long totalRecords,
        List<EntityMention> mentions,
        List<ImportError> errors
) {
    public ImportResult {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return mentions.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be imported.
     *
     * @param recordNumber the record number in the input (1-based, header excluded)
     * @param input        raw input of the record, may be empty
     * @param message      the error message
     */
    public record ImportError(long recordNumber, String input, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + mentions.size() +
                ", errors=" + errors.size() + '}';
    }
}
