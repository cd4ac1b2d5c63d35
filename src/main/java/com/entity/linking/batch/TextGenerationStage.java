package com.entity.linking.batch;

import com.entity.linking.json.ParseOutcome;
import com.entity.linking.json.TolerantJsonParser;
import com.entity.linking.llm.TextGenerationClient;
import com.entity.linking.llm.TextGenerationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for stages that send one prompt per chunk and expect a JSON array of objects back.
 */
abstract class TextGenerationStage<I, K, R> implements BatchStage<I, K, R> {

    protected final TextGenerationClient client;
    protected final TolerantJsonParser parser;

    protected TextGenerationStage(TextGenerationClient client, TolerantJsonParser parser) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.parser = parser != null ? parser : new TolerantJsonParser();
    }

    @Override
    public List<R> process(List<I> chunk) {
        String reply = client.generate(buildPrompt(chunk));
        ParseOutcome<ArrayNode> outcome = parser.parseArray(reply);
        if (!outcome.isParsed()) {
            throw new TextGenerationException(
                    name() + " reply is not a JSON array: " + outcome.reason());
        }

        List<R> rows = new ArrayList<>();
        for (JsonNode element : outcome.value()) {
            if (!element.isObject()) {
                continue;
            }
            R row = readRow(element);
            if (row != null) {
                rows.add(row);
            }
        }
        return rows;
    }

    abstract String buildPrompt(List<I> chunk);

    /**
     * Converts one reply element, or returns null when it cannot be matched to an item.
     */
    abstract R readRow(JsonNode element);

    static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }
}
