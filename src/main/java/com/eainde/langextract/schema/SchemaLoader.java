package com.eainde.langextract.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Reads and writes {@link BasicExtractionSchema} definitions as JSON.
 *
 * <pre>
 * {
 *   "name": "people",
 *   "classes": [
 *     { "name": "PERSON", "fields": [ { "name": "role", "type": "string", "required": true } ] }
 *   ],
 *   "globalFields": [ { "name": "source", "type": "string" } ]
 * }
 * </pre>
 */
@Log4j2
@RequiredArgsConstructor
public class SchemaLoader {

    private final ObjectMapper objectMapper;

    public BasicExtractionSchema fromJson(String json) {
        try {
            BasicExtractionSchema schema = objectMapper.readValue(json, BasicExtractionSchema.class);
            log.debug("Loaded schema '{}' with classes {}", schema.getName(), schema.getClasses());
            return schema;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse schema: " + e.getOriginalMessage(), e);
        }
    }

    public BasicExtractionSchema fromStream(InputStream in) {
        try {
            return objectMapper.readValue(in, BasicExtractionSchema.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema", e);
        }
    }

    public String toJson(BasicExtractionSchema schema) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize schema " + schema.getName(), e);
        }
    }
}
