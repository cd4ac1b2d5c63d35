package com.entity.linking.bulk;

import com.entity.linking.core.model.EntityMention;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonMentionImporterTest {

    private final JsonMentionImporter importer = new JsonMentionImporter();

    @Test
    @DisplayName("Should import an array of mention objects")
    void testImportArray() {
        String json = """
                [
                  {"mention": "Apple", "context": "I ate an apple"},
                  {"mention": "Paris"},
                  {"mention": " IBM ", "context": "  "}
                ]
                """;

        ImportResult result = importer.importMentions(new StringReader(json), null);

        assertEquals(3, result.totalRecords());
        assertFalse(result.hasErrors());
        assertEquals(List.of(
                EntityMention.of("Apple", "I ate an apple"),
                EntityMention.of("Paris"),
                EntityMention.of("IBM")), result.mentions());
    }

    @Test
    @DisplayName("Should record elements without a usable mention as errors")
    void testInvalidElements() {
        String json = """
                [{"mention": ""}, {"context": "no mention"}, "just a string", {"mention": "Rome"}]
                """;

        ImportResult result = importer.importMentions(new StringReader(json), null);

        assertEquals(4, result.totalRecords());
        assertEquals(1, result.successCount());
        assertEquals(3, result.errorCount());
        assertEquals(List.of(1L, 2L, 3L), result.errors().stream().map(ImportResult.ImportError::recordNumber).toList());
    }

    @Test
    @DisplayName("Should use custom field names")
    void testCustomFields() {
        JsonMentionImporter custom = new JsonMentionImporter(new ObjectMapper(), "name", "text");
        ImportResult result = custom.importMentions(
                new StringReader("[{\"name\": \"Rome\", \"text\": \"Rome is a city\"}]"), null);
        assertEquals(List.of(EntityMention.of("Rome", "Rome is a city")), result.mentions());
    }

    @Test
    @DisplayName("Should reject a root that is not an array")
    void testObjectRoot() {
        assertThrows(IllegalArgumentException.class,
                () -> importer.importMentions(new StringReader("{\"mention\": \"Apple\"}"), null));
    }

    @Test
    @DisplayName("Should surface malformed JSON as an I/O error")
    void testMalformed() {
        assertThrows(UncheckedIOException.class,
                () -> importer.importMentions(new StringReader("[{\"mention\": "), null));
    }

    @Test
    void testFormat() {
        assertEquals("json", importer.getFormat());
    }
}
