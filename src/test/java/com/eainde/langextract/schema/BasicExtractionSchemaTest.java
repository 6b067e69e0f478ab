package com.eainde.langextract.schema;

import com.eainde.langextract.extraction.Extraction;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BasicExtractionSchemaTest {

    private final BasicExtractionSchema schema = new BasicExtractionSchema(
            "people",
            "People and organizations",
            List.of(
                    ClassDefinition.of("PERSON",
                            FieldDefinition.string("role", true).withLength(2, 20),
                            FieldDefinition.number("age", false, 0.0, 150.0)),
                    ClassDefinition.of("ORG",
                            FieldDefinition.enumeration("kind", false, List.of("company", "ngo")),
                            FieldDefinition.string("ticker", false).withPattern("[A-Z]{1,5}"))),
            List.of(FieldDefinition.string("source", false)));

    private static Extraction extraction(String cls, String text, Object... attributes) {
        Extraction extraction = new Extraction(cls, text);
        for (int i = 0; i < attributes.length; i += 2) {
            extraction.putAttribute((String) attributes[i], attributes[i + 1]);
        }
        return extraction;
    }

    @Test
    @DisplayName("classes are listed in declaration order")
    void classes() {
        assertThat(schema.getClasses()).containsExactly("PERSON", "ORG");
        assertThat(schema.getClassDefinition("ORG")).isNotNull();
        assertThat(schema.getClassDefinition("MISSING")).isNull();
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("validateExtraction")
    class Validation {

        @Test
        @DisplayName("accepts a conforming extraction and undeclared attributes")
        void accepts() {
            assertThatCode(() -> schema.validateExtraction(
                    extraction("PERSON", "John", "role", "engineer", "age", 42, "extra", List.of(1))))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects an unknown class")
        void unknownClass() {
            assertThatThrownBy(() -> schema.validateExtraction(extraction("PLACE", "Paris")))
                    .isInstanceOfSatisfying(SchemaValidationException.class, e -> {
                        assertThat(e.getField()).isEqualTo("extraction_class");
                        assertThat(e.getConstraint()).isEqualTo("known_class");
                        assertThat(e.getValue()).isEqualTo("PLACE");
                    });
        }

        @Test
        @DisplayName("rejects a missing required field")
        void missingRequired() {
            assertThatThrownBy(() -> schema.validateExtraction(extraction("PERSON", "John")))
                    .isInstanceOfSatisfying(SchemaValidationException.class,
                            e -> assertThat(e.getConstraint()).isEqualTo("required"));
        }

        @Test
        @DisplayName("rejects type, length, range, enum and pattern violations")
        void constraints() {
            assertThat(constraintOf(extraction("PERSON", "John", "role", 7))).isEqualTo("type");
            assertThat(constraintOf(extraction("PERSON", "John", "role", "x"))).isEqualTo("minLength");
            assertThat(constraintOf(extraction("PERSON", "John", "role", "x".repeat(21)))).isEqualTo("maxLength");
            assertThat(constraintOf(extraction("PERSON", "John", "role", "cto", "age", -1))).isEqualTo("minimum");
            assertThat(constraintOf(extraction("PERSON", "John", "role", "cto", "age", 200.5))).isEqualTo("maximum");
            assertThat(constraintOf(extraction("ORG", "Acme", "kind", "government"))).isEqualTo("enum");
            assertThat(constraintOf(extraction("ORG", "Acme", "ticker", "acme"))).isEqualTo("pattern");
            assertThat(constraintOf(extraction("ORG", "Acme", "source", 3))).isEqualTo("type");
        }

        private String constraintOf(Extraction extraction) {
            try {
                schema.validateExtraction(extraction);
                return null;
            } catch (SchemaValidationException e) {
                return e.getConstraint();
            }
        }
    }

    // =========================================================================
    //  Response schema
    // =========================================================================

    @Nested
    @DisplayName("JSON schema")
    class JsonSchemaOutput {

        @Test
        @DisplayName("describes the extractions envelope with a class enum")
        void jsonSchema() {
            ObjectNode root = schema.toJsonSchema();

            assertThat(root.get("title").asText()).isEqualTo("people");
            assertThat(root.at("/required/0").asText()).isEqualTo("extractions");
            assertThat(root.at("/properties/extractions/type").asText()).isEqualTo("array");
            assertThat(root.at("/properties/extractions/items/properties/extraction_class/enum/1").asText())
                    .isEqualTo("ORG");
            assertThat(root.at("/properties/extractions/items/properties/attributes/properties").has("ticker"))
                    .isTrue();
        }

        @Test
        @DisplayName("converts to a langchain4j response schema")
        void responseSchema() {
            JsonSchema response = ResponseSchemaConverter.toResponseSchema(schema);

            assertThat(response.name()).isEqualTo("people");
            JsonObjectSchema root = (JsonObjectSchema) response.rootElement();
            assertThat(root.required()).containsExactly("extractions");
            JsonArraySchema extractions = (JsonArraySchema) root.properties().get("extractions");
            JsonObjectSchema item = (JsonObjectSchema) extractions.items();
            assertThat(item.properties().get("extraction_class")).isInstanceOf(JsonEnumSchema.class);
            assertThat(((JsonEnumSchema) item.properties().get("extraction_class")).enumValues())
                    .containsExactly("PERSON", "ORG");
        }
    }
}
