package com.entity.linking.batch;

import com.entity.linking.json.TolerantJsonParser;
import com.entity.linking.llm.TextGenerationClient;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Batch canonical name normalization: one prompt per chunk of mentions.
 */
public class CanonicalNameStage extends TextGenerationStage<String, String, CanonicalNameRow> {

    public static final String NAME = "canonical_name";

    public CanonicalNameStage(TextGenerationClient client) {
        this(client, new TolerantJsonParser());
    }

    public CanonicalNameStage(TextGenerationClient client, TolerantJsonParser parser) {
        super(client, parser);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String keyOf(String mention) {
        return mention;
    }

    @Override
    public String resultKey(CanonicalNameRow result) {
        return result.mention();
    }

    @Override
    public CanonicalNameRow placeholder(String mention) {
        return CanonicalNameRow.unresolved(mention);
    }

    @Override
    String buildPrompt(List<String> mentions) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Given the following list of entity mentions, return the canonical name ");
        prompt.append("for each as used in knowledge bases. ");
        prompt.append("Respond as a JSON list of objects with fields 'mention' and 'canonical_name'.\n\n");
        prompt.append("Entities:\n");
        for (String mention : mentions) {
            prompt.append("- ").append(mention).append("\n");
        }
        return prompt.toString();
    }

    @Override
    CanonicalNameRow readRow(JsonNode element) {
        JsonNode mention = element.get("mention");
        if (mention == null || !mention.isTextual()) {
            return null;
        }
        return new CanonicalNameRow(mention.asText(), textOrNull(element.get("canonical_name")));
    }
}
