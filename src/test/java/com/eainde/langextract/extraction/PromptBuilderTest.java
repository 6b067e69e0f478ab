package com.eainde.langextract.extraction;

import com.eainde.langextract.schema.BasicExtractionSchema;
import com.eainde.langextract.schema.ClassDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    @Test
    @DisplayName("minimal prompt has header, text and format instructions only")
    void minimal() {
        String prompt = PromptBuilder.build("John Smith works at Google.", null, List.of(), null);

        assertThat(prompt)
                .startsWith(PromptBuilder.HEADER)
                .contains("Text to process:\nJohn Smith works at Google.")
                .contains("\"extractions\"")
                .doesNotContain("Task:")
                .doesNotContain("Examples:")
                .doesNotContain("Expected extraction classes");
    }

    @Test
    @DisplayName("sections appear in order: task, examples, classes, text")
    void fullOrder() {
        ExampleData example = new ExampleData("Mary joined Acme.", List.of(
                new ExampleData.ExampleExtraction("PERSON", "Mary", Map.of("role", "engineer")),
                ExampleData.ExampleExtraction.of("ORG", "Acme")));
        BasicExtractionSchema schema = BasicExtractionSchema.of("people",
                ClassDefinition.of("PERSON"), ClassDefinition.of("ORG"));

        String prompt = PromptBuilder.build("Bob left Initech.", "  Extract people  ", List.of(example), schema);

        assertThat(prompt).contains("Task: Extract people\n");
        assertThat(prompt).contains("Example 1:\nText: Mary joined Acme.\nExtractions:\n- PERSON: Mary (role=engineer)\n- ORG: Acme\n");
        assertThat(prompt).contains("Expected extraction classes: PERSON, ORG");

        int task = prompt.indexOf("Task:");
        int examples = prompt.indexOf("Examples:");
        int classes = prompt.indexOf("Expected extraction classes");
        int text = prompt.indexOf("Text to process:");
        assertThat(task).isLessThan(examples);
        assertThat(examples).isLessThan(classes);
        assertThat(classes).isLessThan(text);
    }

    @Test
    @DisplayName("same inputs build the same prompt")
    void deterministic() {
        String first = PromptBuilder.build("text", "task", List.of(), null);
        String second = PromptBuilder.build("text", "task", List.of(), null);

        assertThat(first).isEqualTo(second);
    }
}
