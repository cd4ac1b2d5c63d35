package com.entity.linking.kb;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InputSanitizer Tests")
class InputSanitizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "bad\u0000mention", "bad\u007Fmention"})
    @DisplayName("Invalid mentions are rejected")
    void invalidMentions(String mention) {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateMention(mention));
    }

    @Test
    @DisplayName("Null and overly long mentions are rejected")
    void nullAndLong() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateMention(null));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateMention("a".repeat(InputSanitizer.MAX_MENTION_LENGTH + 1)));
    }

    @Test
    @DisplayName("Mentions with ordinary whitespace are accepted")
    void validMention() {
        assertDoesNotThrow(() -> InputSanitizer.validateMention("New\tYork\nCity"));
    }
}
