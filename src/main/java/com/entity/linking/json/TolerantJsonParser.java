package com.entity.linking.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Parses JSON out of free text produced by a language model.
 *
 * <p>Three tiers, tried in order:</p>
 * <ol>
 *   <li>strict decode of the whole (trimmed, code-fence stripped) reply</li>
 *   <li>scan for balanced {@code {...}} or {@code [...]} spans, string and escape aware,
 *       and decode each until one succeeds</li>
 *   <li>report {@link ParseOutcome.Status#MALFORMED} if a span was found, otherwise
 *       {@link ParseOutcome.Status#MISSING}; the caller substitutes its default</li>
 * </ol>
 *
 * Instances are thread-safe.
 */
public class TolerantJsonParser {
    private static final Logger log = LoggerFactory.getLogger(TolerantJsonParser.class);

    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private final ObjectMapper objectMapper;

    public TolerantJsonParser() {
        this(new ObjectMapper());
    }

    public TolerantJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Extracts a single JSON object from the text.
     */
    public ParseOutcome<ObjectNode> parseObject(String text) {
        return parse(text, '{', '}').map(node -> (ObjectNode) node);
    }

    /**
     * Extracts a JSON array from the text.
     */
    public ParseOutcome<ArrayNode> parseArray(String text) {
        return parse(text, '[', ']').map(node -> (ArrayNode) node);
    }

    private ParseOutcome<JsonNode> parse(String text, char open, char close) {
        if (text == null || text.isBlank()) {
            return ParseOutcome.missing();
        }
        String trimmed = CODE_FENCE.matcher(text.trim()).replaceAll("").trim();

        JsonNode strict = decode(trimmed);
        if (strict != null && matchesShape(strict, open)) {
            return ParseOutcome.parsed(strict);
        }

        boolean spanFound = false;
        String lastError = null;
        int start = trimmed.indexOf(open);
        while (start >= 0) {
            int end = findBalancedEnd(trimmed, start, open, close);
            if (end < 0) {
                // unclosed bracket, a later one may still open a complete span
                start = trimmed.indexOf(open, start + 1);
                continue;
            }
            spanFound = true;
            String span = trimmed.substring(start, end + 1);
            try {
                JsonNode node = objectMapper.readTree(span);
                if (matchesShape(node, open)) {
                    return ParseOutcome.parsed(node);
                }
            } catch (JsonProcessingException e) {
                lastError = e.getOriginalMessage();
                log.debug("Discarding unparseable JSON span at offset {}: {}", start, lastError);
            }
            start = trimmed.indexOf(open, start + 1);
        }

        if (spanFound) {
            return ParseOutcome.malformed(lastError != null ? lastError : "JSON span has unexpected shape");
        }
        return ParseOutcome.missing();
    }

    private JsonNode decode(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("Reply is not strict JSON, scanning for a span: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean matchesShape(JsonNode node, char open) {
        return open == '{' ? node.isObject() : node.isArray();
    }

    /**
     * Returns the index of the bracket closing the one at {@code start}, or -1 if unbalanced.
     */
    static int findBalancedEnd(String text, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
