package com.entity.linking.bulk;

import com.entity.linking.core.model.BatchRow;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * JSON batch row exporter: a pretty printed array of objects with snake_case field names.
 * Null values are written as JSON null.
 */
public class JsonBatchRowExporter implements BatchRowExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonBatchRowExporter.class);

    private final ObjectMapper objectMapper;

    public JsonBatchRowExporter() {
        this(new ObjectMapper());
    }

    public JsonBatchRowExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ExportResult exportRows(List<BatchRow> rows, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        ArrayNode array = objectMapper.createArrayNode();
        long errorOrAmbiguous = 0;
        for (BatchRow row : rows) {
            array.add(toNode(row));
            if (row.isErrorOrAmbiguous()) {
                errorOrAmbiguous++;
            }
        }

        try {
            objectMapper.writerWithDefaultPrettyPrinter()
                    .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                    .writeValue(writer, array);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON rows", e);
        }

        ExportResult result = new ExportResult(rows.size(), errorOrAmbiguous);
        cb.onProgress(rows.size(), rows.size(), "Export completed");
        log.info("export.completed format=json result={}", result);
        return result;
    }

    ObjectNode toNode(BatchRow row) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("mention", row.mention());
        node.put("context", row.context());
        node.put("canonical_name", row.canonicalName());
        node.put("entity_type", row.entityType() != null ? row.entityType().getLabel() : null);
        node.put("confidence", row.confidence());
        ArrayNode keywords = node.putArray("keywords");
        row.keywords().forEach(keywords::add);
        node.put("description", row.description());
        node.put("uri", row.topCandidateUri());
        node.put("score", row.topCandidateScore());
        return node;
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
