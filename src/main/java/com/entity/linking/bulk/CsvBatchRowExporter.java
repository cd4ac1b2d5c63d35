package com.entity.linking.bulk;

import com.entity.linking.core.model.BatchRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * CSV batch row exporter.
 *
 * <p>Output format:</p>
 * <pre>
 * mention,context,canonical_name,entity_type,confidence,keywords,description,uri,score
 * Apple,I work at Apple,Apple Inc.,company,0.9,technology;iphone,A technology company,KB:Apple_Inc,1.0
 * </pre>
 *
 * Null values are written as empty fields; keywords are joined with {@code ;}.
 */
public class CsvBatchRowExporter implements BatchRowExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvBatchRowExporter.class);

    @Override
    public ExportResult exportRows(List<BatchRow> rows, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long written = 0;
        long errorOrAmbiguous = 0;

        try {
            writer.write(String.join(",", COLUMNS));
            writer.write('\n');
            for (BatchRow row : rows) {
                writer.write(String.join(",",
                        csvEscape(row.mention()),
                        csvEscape(row.context()),
                        csvEscape(row.canonicalName()),
                        csvEscape(row.entityType() != null ? row.entityType().getLabel() : null),
                        formatNumber(row.confidence()),
                        csvEscape(String.join(";", row.keywords())),
                        csvEscape(row.description()),
                        csvEscape(row.topCandidateUri()),
                        formatNumber(row.topCandidateScore())));
                writer.write('\n');
                written++;
                if (row.isErrorOrAmbiguous()) {
                    errorOrAmbiguous++;
                }
            }
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV rows", e);
        }

        ExportResult result = new ExportResult(written, errorOrAmbiguous);
        cb.onProgress(written, rows.size(), "Export completed");
        log.info("export.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String formatNumber(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.4f", value) : "";
    }
}
