package com.entity.linking.analysis;

import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.core.model.EntityCategory;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a model-produced JSON object with {@code entity_type}, {@code confidence},
 * {@code keywords} and {@code description} fields into a {@link ContextSignal}.
 * Lenient on every field: the model's output format is never trusted.
 */
public final class ContextSignalReader {
    private static final Logger log = LoggerFactory.getLogger(ContextSignalReader.class);

    private ContextSignalReader() {
    }

    public static ContextSignal read(JsonNode node) {
        EntityCategory type = EntityCategory.fromLabel(textOrNull(node.get("entity_type")));
        double confidence = readConfidence(node.get("confidence"));
        List<String> keywords = readKeywords(node.get("keywords"));
        String description = textOrNull(node.get("description"));
        return new ContextSignal(type, confidence, keywords,
                description != null ? description : ContextSignal.UNKNOWN_DESCRIPTION);
    }

    static double readConfidence(JsonNode node) {
        double value;
        if (node == null || node.isNull()) {
            return ContextSignal.DEFAULT_CONFIDENCE;
        } else if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim().replace("%", ""));
            } catch (NumberFormatException e) {
                log.debug("Could not parse confidence: {}", node.asText());
                return ContextSignal.DEFAULT_CONFIDENCE;
            }
        } else {
            return ContextSignal.DEFAULT_CONFIDENCE;
        }
        if (Double.isNaN(value)) {
            return ContextSignal.DEFAULT_CONFIDENCE;
        }
        // Percentage format
        if (value > 1.0 && value <= 100.0) {
            value = value / 100.0;
        }
        return Math.min(1.0, Math.max(0.0, value));
    }

    static List<String> readKeywords(JsonNode node) {
        List<String> keywords = new ArrayList<>();
        if (node == null || node.isNull()) {
            return keywords;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && !element.asText().isBlank()) {
                    keywords.add(element.asText().trim());
                }
            }
        } else if (node.isTextual()) {
            for (String keyword : node.asText().split(",")) {
                if (!keyword.isBlank()) {
                    keywords.add(keyword.trim());
                }
            }
        }
        return keywords;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        return node.asText();
    }
}
