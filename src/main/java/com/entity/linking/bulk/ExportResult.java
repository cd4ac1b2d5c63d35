package com.entity.linking.bulk;

/**
 * Result of a batch row export.
 *
 * @param rowsWritten     number of rows written
 * @param errorOrAmbiguous number of written rows missing a canonical name or a URI
 */
public record ExportResult(long rowsWritten, long errorOrAmbiguous) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + ", errorOrAmbiguous=" + errorOrAmbiguous + '}';
    }
}
