package com.entity.linking.bulk;

import com.entity.linking.core.model.EntityMention;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvMentionImporterTest {

    private final CsvMentionImporter importer = new CsvMentionImporter();

    @Test
    @DisplayName("Should import mention and context columns")
    void testImportWithHeader() {
        String csv = """
                mention,context
                Apple,I work at Apple
                Paris,
                IBM,Big Blue hired me
                """;

        ImportResult result = importer.importMentions(new StringReader(csv), null);

        assertEquals(3, result.totalRecords());
        assertEquals(3, result.successCount());
        assertFalse(result.hasErrors());
        assertEquals(List.of(
                EntityMention.of("Apple", "I work at Apple"),
                EntityMention.of("Paris"),
                EntityMention.of("IBM", "Big Blue hired me")), result.mentions());
    }

    @Test
    @DisplayName("Should handle quoted values with commas, escapes and line breaks")
    void testQuotedValues() {
        String csv = "mention,context\n"
                + "\"Acme, Corp\",\"They said \"\"hello\"\"\"\n"
                + "Apple,\"first line\nsecond line\"\n";

        ImportResult result = importer.importMentions(new StringReader(csv), null);

        assertEquals(2, result.totalRecords());
        assertEquals("Acme, Corp", result.mentions().get(0).mention());
        assertEquals("They said \"hello\"", result.mentions().get(0).context());
        assertEquals("first line\nsecond line", result.mentions().get(1).context());
    }

    @Test
    @DisplayName("Should record blank mentions as errors and keep going")
    void testBlankMentions() {
        String csv = """
                mention,context
                Apple,fruit
                ,orphan context
                IBM,
                """;

        ImportResult result = importer.importMentions(new StringReader(csv), null);

        assertEquals(3, result.totalRecords());
        assertEquals(2, result.successCount());
        assertEquals(1, result.errorCount());
        assertEquals(2, result.errors().get(0).recordNumber());
        assertEquals("Blank mention", result.errors().get(0).message());
    }

    @Test
    @DisplayName("Should match column names case-insensitively and in any position")
    void testColumnOrder() {
        String csv = """
                id,Context,MENTION
                1,Tech news,Apple
                """;

        ImportResult result = importer.importMentions(new StringReader(csv), null);

        assertEquals(List.of(EntityMention.of("Apple", "Tech news")), result.mentions());
    }

    @Test
    @DisplayName("Should use custom column names")
    void testCustomColumns() {
        CsvMentionImporter custom = new CsvMentionImporter("name", "sentence");
        String csv = "name,sentence\nRome,Rome is a city\n";

        ImportResult result = custom.importMentions(new StringReader(csv), null);

        assertEquals(List.of(EntityMention.of("Rome", "Rome is a city")), result.mentions());
    }

    @Test
    @DisplayName("Should reject a header without the mention column")
    void testMissingMentionColumn() {
        assertThrows(IllegalArgumentException.class,
                () -> importer.importMentions(new StringReader("name,context\nApple,x\n"), null));
    }

    @Test
    @DisplayName("Should return an empty result for empty input")
    void testEmptyInput() {
        ImportResult result = importer.importMentions(new StringReader(""), null);
        assertEquals(0, result.totalRecords());
        assertTrue(result.mentions().isEmpty());
    }

    @Test
    @DisplayName("Should read UTF-8 input streams")
    void testInputStream() {
        byte[] bytes = "mention\nZürich\n".getBytes(StandardCharsets.UTF_8);
        ImportResult result = importer.importMentions(new ByteArrayInputStream(bytes), null);
        assertEquals("Zürich", result.mentions().get(0).mention());
    }

    @Test
    @DisplayName("Should report completion to the progress callback")
    void testProgressCallback() {
        List<String> messages = new ArrayList<>();
        importer.importMentions(new StringReader("mention\nA\nB\n"),
                (processed, total, message) -> messages.add(processed + "/" + total + " " + message));
        assertEquals(List.of("2/2 Import completed"), messages);
    }

    @Test
    void testFormat() {
        assertEquals("csv", importer.getFormat());
    }
}
