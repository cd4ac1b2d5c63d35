package com.entity.linking.analysis;

import com.entity.linking.kb.InputSanitizer;
import com.entity.linking.llm.TextGenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a mention into the canonical name used as the knowledge base lookup key.
 *
 * The reply is trimmed and returned verbatim. There is no retry and no validation of the
 * returned format; a {@link com.entity.linking.llm.TextGenerationException} propagates to the caller.
 */
public class NameNormalizer {
    private static final Logger log = LoggerFactory.getLogger(NameNormalizer.class);

    private final TextGenerationClient client;

    public NameNormalizer(TextGenerationClient client) {
        this.client = Objects.requireNonNull(client, "client is required");
    }

    /**
     * Returns the canonical name for a mention.
     *
     * @param mention non-blank mention
     * @param context optional surrounding text, may be null
     */
    public String normalize(String mention, String context) {
        InputSanitizer.validateMention(mention);

        String canonicalName = client.generate(buildPrompt(mention, context)).strip();

        log.debug("Normalized '{}' to '{}' via {}", mention, canonicalName, client.getName());
        return canonicalName;
    }

    String buildPrompt(String mention, String context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Given the following entity mention, return the canonical name as used in ");
        prompt.append("knowledge bases (just the name, no explanation):\n");
        prompt.append("Entity: ").append(mention).append("\n");
        if (context != null && !context.isBlank()) {
            prompt.append("\nContext: ").append(context);
        }
        return prompt.toString();
    }
}
