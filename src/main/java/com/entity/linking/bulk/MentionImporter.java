package com.entity.linking.bulk;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads (mention, context) pairs for the batch pipeline from a tabular format.
 * Records with a blank mention are skipped and reported in {@link ImportResult#errors()}.
 */
public interface MentionImporter {

    /**
     * Imports mentions from a reader. The reader is closed when done.
     *
     * @param reader   the reader to read from
     * @param callback optional progress callback
     */
    ImportResult importMentions(Reader reader, ProgressCallback callback);

    /**
     * Imports mentions from a UTF-8 encoded input stream.
     */
    default ImportResult importMentions(InputStream input, ProgressCallback callback) {
        return importMentions(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    /**
     * Returns the format supported by this importer (e.g., "csv", "json").
     */
    String getFormat();
}
