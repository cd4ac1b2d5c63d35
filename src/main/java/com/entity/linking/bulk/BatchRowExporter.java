package com.entity.linking.bulk;

import com.entity.linking.core.model.BatchRow;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes reconciled batch rows in a tabular format.
 * The writer is flushed but not closed.
 */
public interface BatchRowExporter {

    /**
     * Output field names, in column order.
     */
    List<String> COLUMNS = List.of(
            "mention", "context", "canonical_name", "entity_type", "confidence",
            "keywords", "description", "uri", "score");

    /**
     * Exports rows to a writer.
     *
     * @throws java.io.UncheckedIOException if writing fails
     */
    ExportResult exportRows(List<BatchRow> rows, Writer writer, ProgressCallback callback);

    default ExportResult exportRows(List<BatchRow> rows, OutputStream output, ProgressCallback callback) {
        return exportRows(rows, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    /**
     * Returns the format produced by this exporter (e.g., "csv", "json").
     */
    String getFormat();
}
