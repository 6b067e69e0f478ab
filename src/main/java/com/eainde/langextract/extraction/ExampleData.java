package com.eainde.langextract.extraction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A few-shot example: a sample text and the extractions a model should produce for it.
 *
 * @param text        the example source text
 * @param extractions the expected extractions
 */
public record ExampleData(
        @JsonProperty("text") String text,
        @JsonProperty("extractions") List<ExampleExtraction> extractions
) {

    @JsonCreator
    public ExampleData {
        extractions = extractions == null ? List.of() : List.copyOf(extractions);
    }

    /**
     * One expected extraction inside an example.
     */
    public record ExampleExtraction(
            @JsonProperty("extraction_class") String extractionClass,
            @JsonProperty("extraction_text") String extractionText,
            @JsonProperty("attributes") Map<String, Object> attributes
    ) {
        @JsonCreator
        public ExampleExtraction {
            attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public static ExampleExtraction of(String extractionClass, String extractionText) {
            return new ExampleExtraction(extractionClass, extractionText, Map.of());
        }
    }

    public static ExampleData fromJson(ObjectMapper mapper, String json) {
        try {
            return mapper.readValue(json, ExampleData.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to parse example data: " + e.getOriginalMessage(), e);
        }
    }

    public List<ExampleExtraction> extractionsOfClass(String extractionClass) {
        return extractions.stream()
                .filter(e -> extractionClass.equals(e.extractionClass()))
                .toList();
    }

    /**
     * Checks that the text is non-empty and that every extraction is complete and literally
     * present in the example text.
     *
     * @throws IllegalArgumentException describing the first problem found
     */
    public void validate() {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("example text cannot be empty");
        }
        for (int i = 0; i < extractions.size(); i++) {
            ExampleExtraction e = extractions.get(i);
            if (e.extractionClass() == null || e.extractionClass().isBlank()) {
                throw new IllegalArgumentException("example extraction " + i + " has no class");
            }
            if (e.extractionText() == null || e.extractionText().isBlank()) {
                throw new IllegalArgumentException("example extraction " + i + " has no text");
            }
            if (!text.contains(e.extractionText())) {
                throw new IllegalArgumentException(
                        "example extraction " + i + " text \"" + e.extractionText() + "\" not found in example text");
            }
        }
    }
}
