package com.entity.dedup.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonRecordReaderTest {

    private final JsonRecordReader reader = new JsonRecordReader();

    @Test
    @DisplayName("Should read JSON Lines format")
    void testJsonLines() throws IOException {
        String jsonl = """
                {"name": "Jon Smith", "phone": "555-1234"}
                {"name": "John Smith", "phone": "555-1234"}

                {"name": "Amy Jones", "phone": "555-9999"}
                """;

        List<Map<String, Object>> records = reader.read(new StringReader(jsonl));

        assertEquals(3, records.size());
        assertEquals("Amy Jones", records.get(2).get("name"));
    }

    @Test
    @DisplayName("Should read JSON array format")
    void testJsonArray() throws IOException {
        String json = """
                [
                  {"name": "Acme Corp", "employees": 12},
                  {"name": "Big Blue", "tags": ["tech", "hardware"]}
                ]
                """;

        List<Map<String, Object>> records = reader.read(
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));

        assertEquals(2, records.size());
        assertEquals(12, records.get(0).get("employees"));
        assertEquals(List.of("tech", "hardware"), records.get(1).get("tags"));
    }

    @Test
    @DisplayName("Should keep nested objects as maps")
    void testNested() throws IOException {
        List<Map<String, Object>> records = reader.read(new StringReader("""
                {"name": "Jon", "address": {"city": "Springfield"}}
                """));

        assertEquals(Map.of("city", "Springfield"), records.get(0).get("address"));
    }

    @Test
    @DisplayName("Should read from a file")
    void testPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("people.jsonl");
        Files.writeString(file, "{\"name\": \"Jon\"}\n{\"name\": \"Amy\"}\n");

        assertEquals(2, reader.read(file).size());
    }

    @Test
    @DisplayName("Should handle empty input")
    void testEmptyInput() throws IOException {
        assertTrue(reader.read(new StringReader("   ")).isEmpty());
        assertTrue(reader.read(new StringReader("[]")).isEmpty());
    }

    @Test
    @DisplayName("Should fail on malformed input")
    void testMalformed() {
        assertThrows(IOException.class, () -> reader.read(new StringReader("{\"name\": ")));
        assertThrows(IOException.class, () -> reader.read(new StringReader("[1, 2]")));
    }
}
