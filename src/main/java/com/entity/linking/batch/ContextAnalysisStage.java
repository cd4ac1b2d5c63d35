package com.entity.linking.batch;

import com.entity.linking.analysis.ContextSignalReader;
import com.entity.linking.core.model.EntityMention;
import com.entity.linking.json.TolerantJsonParser;
import com.entity.linking.llm.TextGenerationClient;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Batch context classification: one prompt per chunk of (mention, context) pairs.
 * Pairs without context are never sent and keep a null signal.
 */
public class ContextAnalysisStage extends TextGenerationStage<EntityMention, EntityMention, ContextAnalysisRow> {

    public static final String NAME = "context_analysis";

    public ContextAnalysisStage(TextGenerationClient client) {
        this(client, new TolerantJsonParser());
    }

    public ContextAnalysisStage(TextGenerationClient client, TolerantJsonParser parser) {
        super(client, parser);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EntityMention keyOf(EntityMention item) {
        return item;
    }

    @Override
    public EntityMention resultKey(ContextAnalysisRow result) {
        return result.toMention();
    }

    @Override
    public ContextAnalysisRow placeholder(EntityMention item) {
        return ContextAnalysisRow.unresolved(item);
    }

    @Override
    public boolean isProcessable(EntityMention item) {
        return item.hasContext();
    }

    @Override
    String buildPrompt(List<EntityMention> pairs) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Given the following list of entity mentions and their contexts, ");
        prompt.append("analyze each pair and return a JSON list of objects with fields: ");
        prompt.append("'mention', 'context', 'entity_type' (person, company, place, product, concept, or other), ");
        prompt.append("'confidence' (0-1), 'keywords' (list), and 'description' (brief description). ");
        prompt.append("Copy 'mention' and 'context' exactly as given.\n\n");
        prompt.append("Pairs:\n");
        for (EntityMention pair : pairs) {
            prompt.append("- mention: ").append(pair.mention()).append("\n");
            prompt.append("  context: ").append(pair.context()).append("\n");
        }
        return prompt.toString();
    }

    @Override
    ContextAnalysisRow readRow(JsonNode element) {
        JsonNode mention = element.get("mention");
        if (mention == null || !mention.isTextual()) {
            return null;
        }
        JsonNode context = element.get("context");
        String contextText = context != null && context.isTextual() ? context.asText() : null;
        return new ContextAnalysisRow(mention.asText(), contextText, ContextSignalReader.read(element));
    }
}
