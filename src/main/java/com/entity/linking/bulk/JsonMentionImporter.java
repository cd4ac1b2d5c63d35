package com.entity.linking.bulk;

import com.entity.linking.core.model.EntityMention;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON mention importer.
 *
 * <p>Expected format, an array of objects:</p>
 * <pre>
 * [
 *   {"mention": "Apple", "context": "Apple released a new iPhone"},
 *   {"mention": "Paris"}
 * ]
 * </pre>
 *
 * Field names are configurable; the context field is optional.
 */
public class JsonMentionImporter implements MentionImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonMentionImporter.class);

    private final ObjectMapper objectMapper;
    private final String mentionField;
    private final String contextField;

    public JsonMentionImporter() {
        this(new ObjectMapper(), "mention", "context");
    }

    public JsonMentionImporter(ObjectMapper objectMapper, String mentionField, String contextField) {
        this.objectMapper = objectMapper;
        this.mentionField = mentionField;
        this.contextField = contextField;
    }

    /**
     * @throws IllegalArgumentException if the document is not a JSON array
     * @throws UncheckedIOException     if reading or parsing fails
     */
    @Override
    public ImportResult importMentions(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        JsonNode root;
        try (Reader r = reader) {
            root = objectMapper.readTree(r);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON mentions", e);
        }
        if (root == null || root.isMissingNode()) {
            return new ImportResult(0, List.of(), List.of());
        }
        if (!root.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of mention objects, got " + root.getNodeType());
        }

        List<EntityMention> mentions = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;
        for (JsonNode element : root) {
            totalRecords++;
            JsonNode mention = element.isObject() ? element.get(mentionField) : null;
            if (mention == null || !mention.isValueNode() || mention.isNull() || mention.asText().isBlank()) {
                errors.add(new ImportResult.ImportError(totalRecords, element.toString(), "Blank mention"));
                log.warn("import.error record={} error=blank mention", totalRecords);
                continue;
            }
            JsonNode context = contextField != null ? element.get(contextField) : null;
            String contextText = context != null && context.isValueNode() && !context.isNull()
                    && !context.asText().isBlank() ? context.asText() : null;
            mentions.add(new EntityMention(mention.asText().strip(), contextText));
        }

        ImportResult result = new ImportResult(totalRecords, mentions, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format=json result={}", result);
        return result;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
