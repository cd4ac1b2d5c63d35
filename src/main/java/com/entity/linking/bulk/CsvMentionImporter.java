package com.entity.linking.bulk;

import com.entity.linking.core.model.EntityMention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV mention importer.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * mention,context
 * Apple,"Apple released a new iPhone, again"
 * Paris,
 * </pre>
 *
 * <p>The first record is the header. Column names are configurable; the context column is
 * optional. Quoted fields may contain commas, line breaks and {@code ""} escapes.</p>
 */
public class CsvMentionImporter implements MentionImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMentionImporter.class);
    private static final int PROGRESS_INTERVAL = 100;

    private final String mentionColumn;
    private final String contextColumn;

    public CsvMentionImporter() {
        this("mention", "context");
    }

    public CsvMentionImporter(String mentionColumn, String contextColumn) {
        this.mentionColumn = mentionColumn;
        this.contextColumn = contextColumn;
    }

    /**
     * @throws IllegalArgumentException if the header lacks the mention column
     * @throws UncheckedIOException     if reading fails
     */
    @Override
    public ImportResult importMentions(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<EntityMention> mentions = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String header = readRecord(br);
            if (header == null) {
                return new ImportResult(0, List.of(), List.of());
            }
            List<String> columns = parseRecord(header);
            int mentionIndex = indexOf(columns, mentionColumn);
            if (mentionIndex < 0) {
                throw new IllegalArgumentException("CSV header has no '" + mentionColumn + "' column: " + columns);
            }
            int contextIndex = contextColumn != null ? indexOf(columns, contextColumn) : -1;

            String record;
            while ((record = readRecord(br)) != null) {
                if (record.isBlank()) {
                    continue;
                }
                totalRecords++;
                List<String> fields = parseRecord(record);
                String mention = fieldAt(fields, mentionIndex);
                if (mention == null || mention.isBlank()) {
                    errors.add(new ImportResult.ImportError(totalRecords, record, "Blank mention"));
                    log.warn("import.error record={} error=blank mention", totalRecords);
                    continue;
                }
                String context = contextIndex >= 0 ? fieldAt(fields, contextIndex) : null;
                mentions.add(new EntityMention(mention.strip(),
                        context != null && !context.isBlank() ? context : null));

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Read " + totalRecords + " records");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CSV mentions", e);
        }

        ImportResult result = new ImportResult(totalRecords, mentions, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format=csv result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    /**
     * Reads one logical record, joining physical lines while a quoted field is open.
     */
    static String readRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder record = new StringBuilder(line);
        while (countQuotes(record) % 2 != 0) {
            String next = reader.readLine();
            if (next == null) {
                break;
            }
            record.append('\n').append(next);
        }
        return record.toString();
    }

    /**
     * Splits a record into fields, unquoting quoted ones.
     */
    static List<String> parseRecord(String record) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < record.length() && record.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }

    private static int countQuotes(CharSequence text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '"') {
                count++;
            }
        }
        return count;
    }

    private static int indexOf(List<String> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).strip().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String fieldAt(List<String> fields, int index) {
        return index < fields.size() ? fields.get(index) : null;
    }
}
