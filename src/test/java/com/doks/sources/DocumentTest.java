package com.doks.sources;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DocumentTest {

    @Test
    void shouldDefaultMissingTextFields() {
        Document document = new Document("id-1", "notes", null, null, null, null);

        assertEquals("", document.title());
        assertEquals("", document.link());
        assertEquals("", document.content());
        assertEquals(Map.of(), document.metadata());
    }

    @Test
    void shouldCopyMetadata() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("lang", "en");
        Document document = new Document("id-1", "notes", "t", "l", "c", metadata);

        metadata.put("lang", "fr");

        assertEquals("en", document.metadata().get("lang"));
        assertThrows(UnsupportedOperationException.class, () -> document.metadata().put("x", "y"));
    }

    @Test
    void shouldRejectBlankIdOrSource() {
        assertThrows(IllegalArgumentException.class, () -> new Document(" ", "notes", "t", "l", "c"));
        assertThrows(IllegalArgumentException.class, () -> new Document("id", "", "t", "l", "c"));
    }
}
