package com.eainde.langextract.extraction;

import com.eainde.langextract.schema.ExtractionSchema;

import java.util.List;
import java.util.Map;

/**
 * Builds the extraction prompt sent to a model.
 *
 * <p>The layout is fixed:</p>
 * <pre>
 * Extract structured information from the following text.
 *
 * Task: ...
 *
 * Examples:
 *
 * Example 1:
 * Text: ...
 * Extractions:
 * - CLASS: text
 *
 * Expected extraction classes: A, B
 *
 * Text to process:
 * ...
 *
 * Please extract entities in the following JSON format: { "extractions": [ ... ] }
 * </pre>
 */
public final class PromptBuilder {

    static final String HEADER = "Extract structured information from the following text.";

    private PromptBuilder() {
    }

    public static String build(String text, String taskDescription, List<ExampleData> examples,
                               ExtractionSchema schema) {
        StringBuilder prompt = new StringBuilder(text.length() + 512);
        prompt.append(HEADER).append("\n\n");

        if (taskDescription != null && !taskDescription.isBlank()) {
            prompt.append("Task: ").append(taskDescription.strip()).append("\n\n");
        }

        if (examples != null && !examples.isEmpty()) {
            prompt.append("Examples:\n");
            for (int i = 0; i < examples.size(); i++) {
                ExampleData example = examples.get(i);
                prompt.append("\nExample ").append(i + 1).append(":\n");
                prompt.append("Text: ").append(example.text()).append('\n');
                if (!example.extractions().isEmpty()) {
                    prompt.append("Extractions:\n");
                    for (ExampleData.ExampleExtraction e : example.extractions()) {
                        prompt.append("- ").append(e.extractionClass()).append(": ").append(e.extractionText());
                        appendAttributes(prompt, e.attributes());
                        prompt.append('\n');
                    }
                }
            }
            prompt.append('\n');
        }

        if (schema != null && !schema.getClasses().isEmpty()) {
            prompt.append("Expected extraction classes: ")
                    .append(String.join(", ", schema.getClasses()))
                    .append("\n\n");
        }

        prompt.append("Text to process:\n").append(text).append("\n\n");

        prompt.append("Please extract entities in the following JSON format:\n")
                .append("{\n")
                .append("  \"extractions\": [\n")
                .append("    {\n")
                .append("      \"extraction_class\": \"class_name\",\n")
                .append("      \"extraction_text\": \"extracted_text\",\n")
                .append("      \"confidence\": 0.95\n")
                .append("    }\n")
                .append("  ]\n")
                .append("}");
        return prompt.toString();
    }

    private static void appendAttributes(StringBuilder prompt, Map<String, Object> attributes) {
        if (attributes.isEmpty()) {
            return;
        }
        prompt.append(" (");
        boolean first = true;
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            if (!first) {
                prompt.append(", ");
            }
            prompt.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        prompt.append(')');
    }
}
