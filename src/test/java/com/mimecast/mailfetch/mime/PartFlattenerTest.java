package com.mimecast.mailfetch.mime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PartFlattenerTest {

    private final PartFlattener flattener = new PartFlattener();

    @Test
    @DisplayName("Flat children are numbered from 1")
    void flat() {
        Map<String, FlattenedPart> flat = flattener.flatten(List.of(
                Parts.plain(),
                Parts.html(),
                Parts.file(PartType.IMAGE, "png", "a.png")));

        assertEquals(List.of("1", "2", "3"), List.copyOf(flat.keySet()));
        assertEquals("text/plain", flat.get("1").descriptor().getMimeType());
        assertFalse(flat.get("3").container());
    }

    @Test
    void nestedMultipart() {
        Map<String, FlattenedPart> flat = flattener.flatten(List.of(
                Parts.multipart("alternative", Parts.plain(), Parts.html()),
                Parts.multipart("mixed",
                        Parts.file(PartType.APPLICATION, "pdf", "a.pdf"),
                        Parts.multipart("related", Parts.html(), Parts.file(PartType.IMAGE, "png", "b.png")))));

        assertEquals(List.of("1", "1.1", "1.2", "2", "2.1", "2.2", "2.2.1", "2.2.2"), List.copyOf(flat.keySet()));
        assertTrue(flat.get("1").container());
        assertTrue(flat.get("2.2").container());
        assertFalse(flat.get("2.2.1").container());
    }

    @Test
    @DisplayName("Linearized entries carry no sub-parts")
    void entriesStripped() {
        Map<String, FlattenedPart> flat = flattener.flatten(List.of(Parts.multipart("alternative", Parts.plain(), Parts.html())));

        for (FlattenedPart part : flat.values()) {
            assertTrue(part.descriptor().getParts().isEmpty());
        }
    }

    @Test
    @DisplayName("Message children restart at 0 without extending the prefix below")
    void message() {
        Map<String, FlattenedPart> flat = flattener.flatten(List.of(
                Parts.plain(),
                Parts.rfc822("inline", Parts.multipart("mixed",
                        Parts.plain(),
                        Parts.multipart("alternative", Parts.plain(), Parts.html())))));

        assertEquals(List.of("1", "2", "2.0", "2.1", "2.2", "2.2.1", "2.2.2"), List.copyOf(flat.keySet()));
        assertEquals(PartType.MESSAGE, flat.get("2").descriptor().getType());
        assertEquals(PartType.MULTIPART, flat.get("2.0").descriptor().getType());
    }

    @Test
    void embeddedFlag() {
        Map<String, FlattenedPart> flat = flattener.flatten(List.of(
                Parts.plain(),
                Parts.rfc822("attachment", Parts.multipart("mixed", Parts.plain(), Parts.html()))));

        assertFalse(flat.get("1").embedded());
        assertFalse(flat.get("2").embedded());
        assertTrue(flat.get("2.0").embedded());
        assertTrue(flat.get("2.1").embedded());
        assertTrue(flat.get("2.2").embedded());
    }

    @Test
    void empty() {
        assertTrue(flattener.flatten(List.of()).isEmpty());
    }
}
