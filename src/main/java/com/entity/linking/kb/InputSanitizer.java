package com.entity.linking.kb;

/**
 * Input validation utility for linking operations.
 * Validates mentions before they reach a provider or knowledge base.
 */
public final class InputSanitizer {

    /** Maximum allowed length for mentions and labels. */
    public static final int MAX_MENTION_LENGTH = 1000;

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a mention before it is sent to an external service.
     * Rejects null, blank, overly long, or control-character-containing mentions.
     *
     * @param mention the mention to validate
     * @throws IllegalArgumentException if the mention is invalid
     */
    public static void validateMention(String mention) {
        if (mention == null || mention.isBlank()) {
            throw new IllegalArgumentException("Mention must not be null or blank");
        }
        if (mention.length() > MAX_MENTION_LENGTH) {
            throw new IllegalArgumentException(
                    "Mention exceeds maximum length of " + MAX_MENTION_LENGTH +
                            " characters (was " + mention.length() + ")");
        }
        if (containsControlCharacters(mention)) {
            throw new IllegalArgumentException("Mention must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding common whitespace characters (tab, newline, carriage return).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 && c != '\t' && c != '\n' && c != '\r') {
                return true;
            }
            if (c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
