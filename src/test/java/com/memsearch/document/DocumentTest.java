package com.memsearch.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentTest {

    @Test
    void testGetFieldReturnsDefaultWhenMissing() {
        Document document = new Document(0, Map.of("body", "this is a Test"));

        assertEquals("this is a Test", document.getField("body", ""));
        assertEquals("", document.getField("title", ""));
        assertEquals("n/a", document.getField("meta", "n/a"));
    }

    @Test
    void testFieldsAreCopiedAndUnmodifiable() {
        Map<String, String> fields = new HashMap<>();
        fields.put("body", "original");
        Document document = new Document(3, fields);

        fields.put("body", "changed");

        assertEquals("original", document.getField("body", ""));
        assertThrows(UnsupportedOperationException.class, () -> document.fields().put("meta", "x"));
    }

    @Test
    void testOfSingleField() {
        Document document = Document.of(7, "body", "hello");

        assertEquals(7, document.documentId());
        assertEquals(Map.of("body", "hello"), document.fields());
    }

    @Test
    void testRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new Document(-1, Map.of()));
        assertThrows(IllegalArgumentException.class, () -> new Document(0, null));
    }
}
