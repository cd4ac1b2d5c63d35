package com.entity.linking.analysis;

import com.entity.linking.core.model.ContextSignal;
import com.entity.linking.json.ParseOutcome;
import com.entity.linking.json.TolerantJsonParser;
import com.entity.linking.llm.TextGenerationClient;
import com.entity.linking.llm.TextGenerationException;
import com.entity.linking.metrics.MetricsService;
import com.entity.linking.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Classifies a mention in its context into a {@link ContextSignal}.
 *
 * <p>Context analysis enhances linking but is never a hard dependency of it, so this
 * class never raises on bad model output or transport failure:</p>
 * <ul>
 *   <li>no JSON object in the reply: {@link ContextSignal#unknown()}</li>
 *   <li>a JSON object that does not decode, a transport error or any other provider failure:
 *       {@link ContextSignal#analysisError()}</li>
 * </ul>
 */
public class ContextClassifier {
    private static final Logger log = LoggerFactory.getLogger(ContextClassifier.class);

    private final TextGenerationClient client;
    private final TolerantJsonParser parser;
    private final MetricsService metricsService;

    public ContextClassifier(TextGenerationClient client) {
        this(client, new TolerantJsonParser(), new NoOpMetricsService());
    }

    public ContextClassifier(TextGenerationClient client, TolerantJsonParser parser,
                             MetricsService metricsService) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.parser = parser != null ? parser : new TolerantJsonParser();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public ContextSignal classify(String mention, String context) {
        Objects.requireNonNull(mention, "mention is required");

        String reply;
        try {
            reply = client.generate(buildPrompt(mention, context));
        } catch (TextGenerationException e) {
            log.warn("context.analysis.failed mention='{}' provider={} error={}",
                    mention, client.getName(), e.getMessage());
            metricsService.incrementContextFallback();
            return ContextSignal.analysisError();
        } catch (RuntimeException e) {
            log.error("context.analysis.failed mention='{}' provider={} unexpected provider error",
                    mention, client.getName(), e);
            metricsService.incrementContextFallback();
            return ContextSignal.analysisError();
        }

        ParseOutcome<ObjectNode> outcome = parser.parseObject(reply);
        return switch (outcome.status()) {
            case PARSED -> {
                ContextSignal signal = ContextSignalReader.read(outcome.value());
                log.debug("Context analysis for '{}': type={} confidence={} keywords={}",
                        mention, signal.entityType(), signal.confidence(), signal.keywords());
                yield signal;
            }
            case MALFORMED -> {
                log.warn("context.analysis.malformed mention='{}' reason={}", mention, outcome.reason());
                metricsService.incrementContextFallback();
                yield ContextSignal.analysisError();
            }
            case MISSING -> {
                log.warn("context.analysis.missing mention='{}' no JSON object in reply", mention);
                metricsService.incrementContextFallback();
                yield ContextSignal.unknown();
            }
        };
    }

    String buildPrompt(String mention, String context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Analyze the following entity mention and context to determine the most likely ");
        prompt.append("entity type and characteristics.\n");
        prompt.append("Return your analysis as a JSON object with the following fields:\n");
        prompt.append("- entity_type: \"person\", \"company\", \"place\", \"product\", \"concept\", or \"other\"\n");
        prompt.append("- confidence: confidence score (0-1)\n");
        prompt.append("- keywords: list of relevant keywords that might help in disambiguation\n");
        prompt.append("- description: brief description of what this entity likely refers to\n\n");
        prompt.append("Entity: ").append(mention).append("\n");
        prompt.append("Context: ").append(context).append("\n\n");
        prompt.append("Return only the JSON object, no additional text.\n");
        return prompt.toString();
    }
}
