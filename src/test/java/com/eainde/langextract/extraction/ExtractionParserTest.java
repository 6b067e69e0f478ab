package com.eainde.langextract.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtractionParserTest {

    private final ExtractionParser parser = new ExtractionParser(new ObjectMapper());

    // =========================================================================
    //  Well-formed responses
    // =========================================================================

    @Nested
    @DisplayName("Well-formed responses")
    class WellFormed {

        @Test
        @DisplayName("should parse class, text, confidence and indices")
        void basic() {
            String json = """
                    {"extractions": [
                      {"extraction_class": "PERSON", "extraction_text": "John Smith", "confidence": 0.9},
                      {"extraction_class": "ORG", "extraction_text": "Google Inc."}
                    ]}
                    """;

            List<Extraction> result = parser.parse(json, 2);

            assertThat(result).hasSize(2);
            Extraction person = result.get(0);
            assertThat(person.getExtractionClass()).isEqualTo("PERSON");
            assertThat(person.getExtractionText()).isEqualTo("John Smith");
            assertThat(person.getConfidence()).isEqualTo(0.9);
            assertThat(person.getExtractionIndex()).isZero();
            assertThat(person.getGroupIndex()).isEqualTo(2);

            Extraction org = result.get(1);
            assertThat(org.hasConfidence()).isFalse();
            assertThat(org.getExtractionIndex()).isEqualTo(1);
        }

        @Test
        @DisplayName("should strip markdown fences and surrounding prose")
        void fences() {
            String output = "Here you go:\n```json\n{\"extractions\": [{\"extraction_class\": \"ORG\", "
                    + "\"extraction_text\": \"Acme\"}]}\n```\nHope it helps.";

            List<Extraction> result = parser.parse(output, 0);

            assertThat(result).extracting(Extraction::getExtractionText).containsExactly("Acme");
        }

        @Test
        @DisplayName("should flatten nested attributes and keep unknown keys as attributes")
        void attributes() {
            String json = """
                    {"extractions": [{
                      "extraction_class": "PERSON",
                      "extraction_text": "John",
                      "attributes": {"role": "engineer", "age": 42},
                      "nickname": "JJ"
                    }]}
                    """;

            Extraction extraction = parser.parse(json, 0).get(0);

            assertThat(extraction.getAttributes())
                    .containsEntry("role", "engineer")
                    .containsEntry("age", 42)
                    .containsEntry("nickname", "JJ")
                    .doesNotContainKeys("extraction_class", "extraction_text", "attributes");
        }

        @Test
        @DisplayName("should skip incomplete items and reindex the rest")
        void skipsIncomplete() {
            String json = """
                    {"extractions": [
                      "not an object",
                      {"extraction_class": "PERSON"},
                      {"extraction_text": "orphan"},
                      {"extraction_class": "ORG", "extraction_text": "  "},
                      {"extraction_class": "ORG", "extraction_text": "Acme"}
                    ]}
                    """;

            List<Extraction> result = parser.parse(json, 0);

            assertThat(result).singleElement().satisfies(e -> {
                assertThat(e.getExtractionText()).isEqualTo("Acme");
                assertThat(e.getExtractionIndex()).isZero();
            });
        }

        @Test
        @DisplayName("should accept an empty extractions array")
        void emptyArray() {
            assertThat(parser.parse("{\"extractions\": []}", 0)).isEmpty();
        }

        @Test
        @DisplayName("should ignore a non-numeric confidence")
        void nonNumericConfidence() {
            String json = "{\"extractions\": [{\"extraction_class\": \"A\", \"extraction_text\": \"x\", \"confidence\": \"high\"}]}";

            assertThat(parser.parse(json, 0).get(0).hasConfidence()).isFalse();
        }
    }

    // =========================================================================
    //  Malformed responses
    // =========================================================================

    @Nested
    @DisplayName("Malformed responses")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\n"})
        @DisplayName("blank output is rejected")
        void blank(String output) {
            assertThatThrownBy(() -> parser.parse(output, 0))
                    .isInstanceOf(ResponseParseException.class)
                    .hasMessageContaining("empty");
        }

        @Test
        @DisplayName("null output is rejected")
        void nullOutput() {
            assertThatThrownBy(() -> parser.parse(null, 0)).isInstanceOf(ResponseParseException.class);
        }

        @Test
        @DisplayName("invalid JSON is rejected")
        void invalidJson() {
            assertThatThrownBy(() -> parser.parse("{\"extractions\": [", 0))
                    .isInstanceOf(ResponseParseException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("a missing extractions field is rejected")
        void missingField() {
            assertThatThrownBy(() -> parser.parse("{\"items\": []}", 0))
                    .isInstanceOf(ResponseParseException.class)
                    .hasMessageContaining("no 'extractions' field");
        }

        @Test
        @DisplayName("a non-array extractions field is rejected")
        void notArray() {
            assertThatThrownBy(() -> parser.parse("{\"extractions\": {}}", 0))
                    .isInstanceOf(ResponseParseException.class)
                    .hasMessageContaining("not an array");
        }
    }

    @Test
    @DisplayName("cleanJson keeps the outermost object")
    void cleanJson() {
        assertThat(ExtractionParser.cleanJson("```JSON\n{\"a\": {\"b\": 1}}\n```"))
                .isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(ExtractionParser.cleanJson("no json here")).isEqualTo("no json here");
    }

    @Test
    @DisplayName("nested attribute values are converted to plain collections")
    void nestedValues() {
        String json = "{\"extractions\": [{\"extraction_class\": \"A\", \"extraction_text\": \"x\", "
                + "\"attributes\": {\"tags\": [\"a\", \"b\"], \"meta\": {\"k\": \"v\"}}}]}";

        Extraction extraction = parser.parse(json, 0).get(0);

        assertThat(extraction.getAttributes().get("tags")).isEqualTo(List.of("a", "b"));
        assertThat(extraction.getAttributes().get("meta")).isEqualTo(Map.of("k", "v"));
    }
}
