package com.partinspect.render.input;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonDocumentReaderTest {

    private final JsonDocumentReader reader = new JsonDocumentReader();

    @Test
    void objectsKeepKeyOrderAndNumbersStayIntegral() {
        Object doc = reader.parse("{\"zeta\": 1, \"alpha\": [1.5, true, \"x\"]}");

        Map<?, ?> map = assertInstanceOf(Map.class, doc);
        assertEquals(List.of("zeta", "alpha"), List.copyOf(map.keySet()));
        assertEquals(1L, map.get("zeta"));
        assertEquals(Arrays.asList(1.5, true, "x"), map.get("alpha"));
    }

    @Test
    void readsFromFile(@TempDir Path tmp) throws IOException {
        Path file = tmp.resolve("doc.json");
        Files.writeString(file, "[1, 2, 3]");
        assertEquals(List.of(1L, 2L, 3L), reader.read(file));
    }

    @Test
    void malformedJsonThrows() {
        assertThrows(JsonDocumentReader.DocumentReadException.class, () -> reader.parse("{\"a\": }"));
    }

    @Test
    void missingFileThrows(@TempDir Path tmp) {
        JsonDocumentReader.DocumentReadException e = assertThrows(JsonDocumentReader.DocumentReadException.class,
            () -> reader.read(tmp.resolve("missing.json")));
        assertTrue(e.getMessage().contains("missing.json"));
    }
}
