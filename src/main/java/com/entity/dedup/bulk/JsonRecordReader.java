package com.entity.dedup.bulk;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads input records for a deduplication run.
 *
 * <p>Accepts either a JSON array of objects:</p>
 * <pre>
 * [
 *   {"name": "Jon Smith", "phone": "555-1234"},
 *   {"name": "John Smith", "phone": "555-1234"}
 * ]
 * </pre>
 *
 * <p>or JSON Lines, one object per line:</p>
 * <pre>
 * {"name": "Jon Smith", "address": {"city": "Springfield"}}
 * {"name": "Amy Jones", "address": {"city": "Shelbyville"}}
 * </pre>
 *
 * <p>Nested objects are kept as maps so that dot-path attributes such as
 * {@code address.city} resolve against them. Record order is input order.</p>
 */
public class JsonRecordReader {
    private static final Logger log = LoggerFactory.getLogger(JsonRecordReader.class);

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonRecordReader() {
        this(new ObjectMapper());
    }

    public JsonRecordReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public List<Map<String, Object>> read(InputStream input) throws IOException {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * Reads all records from the reader. The reader is not closed.
     *
     * @throws IOException if the input is not a JSON array of objects or a sequence of objects
     */
    public List<Map<String, Object>> read(Reader reader) throws IOException {
        try (JsonParser parser = objectMapper.createParser(reader)) {
            parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
            JsonToken first = parser.nextToken();
            List<Map<String, Object>> records;
            if (first == null) {
                records = List.of();
            } else if (first == JsonToken.START_ARRAY) {
                records = objectMapper.readValue(parser, RECORDS_TYPE);
            } else {
                records = new ArrayList<>();
                try (MappingIterator<Map<String, Object>> lines = objectMapper.readValues(parser, RECORD_TYPE)) {
                    while (lines.hasNextValue()) {
                        records.add(lines.nextValue());
                    }
                }
            }
            log.info("records.read count={} format={}", records.size(), first == JsonToken.START_ARRAY ? "array" : "jsonl");
            return records;
        }
    }
}
