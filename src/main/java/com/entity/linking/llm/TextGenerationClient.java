package com.entity.linking.llm;

/**
 * Interface for text generation (LLM) integration.
 *
 * A client only turns a prompt into raw text. Any structure (JSON shape) is requested
 * through the prompt and the reply is untrusted.
 */
public interface TextGenerationClient {

    /**
     * Sends a prompt and returns the raw generated text.
     *
     * @param prompt the prompt text
     * @return the generated text, never null
     * @throws TextGenerationException if the service is unreachable or returns an error
     */
    String generate(String prompt);

    /**
     * Returns the name/identifier of this provider.
     */
    String getName();

    /**
     * Checks if the provider is reachable and configured.
     */
    default boolean isAvailable() {
        return true;
    }
}
