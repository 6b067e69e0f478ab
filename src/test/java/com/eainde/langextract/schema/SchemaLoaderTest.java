package com.eainde.langextract.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaLoaderTest {

    private final SchemaLoader loader = new SchemaLoader(new ObjectMapper());

    @Test
    @DisplayName("should load classes, fields and global fields from JSON")
    void fromJson() {
        String json = """
                {
                  "name": "people",
                  "description": "People",
                  "classes": [
                    {"name": "PERSON", "fields": [
                      {"name": "role", "type": "string", "required": true, "enum": ["cto", "ceo"]},
                      {"name": "age", "type": "number", "minimum": 0}
                    ]}
                  ],
                  "globalFields": [{"name": "source", "type": "string"}],
                  "version": 3
                }
                """;

        BasicExtractionSchema schema = loader.fromJson(json);

        assertThat(schema.getName()).isEqualTo("people");
        assertThat(schema.getClasses()).containsExactly("PERSON");
        FieldDefinition role = schema.getClassDefinition("PERSON").fields().get(0);
        assertThat(role.required()).isTrue();
        assertThat(role.enumValues()).containsExactly("cto", "ceo");
        assertThat(schema.getClassDefinition("PERSON").fields().get(1).minimum()).isEqualTo(0.0);
        assertThat(schema.getGlobalFields()).extracting(FieldDefinition::name).containsExactly("source");
    }

    @Test
    @DisplayName("should load from a classpath stream")
    void fromStream() {
        InputStream in = new ByteArrayInputStream(
                "{\"name\": \"s\", \"classes\": [{\"name\": \"ORG\"}]}".getBytes(StandardCharsets.UTF_8));

        assertThat(loader.fromStream(in).getClasses()).containsExactly("ORG");
    }

    @Test
    @DisplayName("written JSON reads back to an equivalent schema")
    void writeThenRead() {
        BasicExtractionSchema original = new BasicExtractionSchema("people", null,
                List.of(ClassDefinition.of("PERSON", FieldDefinition.string("role", true).withPattern("[a-z]+"))),
                List.of());

        BasicExtractionSchema reloaded = loader.fromJson(loader.toJson(original));

        assertThat(reloaded.getClasses()).isEqualTo(original.getClasses());
        assertThat(reloaded.getClassDefinitions()).isEqualTo(original.getClassDefinitions());
    }

    @Test
    @DisplayName("malformed JSON is an IllegalArgumentException")
    void malformed() {
        assertThatThrownBy(() -> loader.fromJson("{\"name\": "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Failed to parse schema");
    }
}
