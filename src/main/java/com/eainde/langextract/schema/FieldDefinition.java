package com.eainde.langextract.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Constraints for one extraction attribute.
 *
 * @param name        attribute key
 * @param type        one of {@code string}, {@code number}, {@code boolean}, {@code array};
 *                    anything else is accepted without type checks
 * @param description human-readable description, used in the response schema
 * @param required    whether the attribute must be present
 * @param enumValues  allowed string values (empty means unrestricted)
 * @param pattern     regular expression a string value must fully match
 * @param minLength   minimum string length
 * @param maxLength   maximum string length
 * @param minimum     minimum numeric value
 * @param maximum     maximum numeric value
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("description") String description,
        @JsonProperty("required") boolean required,
        @JsonProperty("enum") List<String> enumValues,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("minLength") Integer minLength,
        @JsonProperty("maxLength") Integer maxLength,
        @JsonProperty("minimum") Double minimum,
        @JsonProperty("maximum") Double maximum
) {

    public FieldDefinition {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static FieldDefinition string(String name, boolean required) {
        return new FieldDefinition(name, "string", null, required, null, null, null, null, null, null);
    }

    public static FieldDefinition number(String name, boolean required, Double minimum, Double maximum) {
        return new FieldDefinition(name, "number", null, required, null, null, null, null, minimum, maximum);
    }

    public static FieldDefinition enumeration(String name, boolean required, List<String> values) {
        return new FieldDefinition(name, "string", null, required, values, null, null, null, null, null);
    }

    public FieldDefinition withLength(Integer min, Integer max) {
        return new FieldDefinition(name, type, description, required, enumValues, pattern, min, max, minimum, maximum);
    }

    public FieldDefinition withPattern(String regex) {
        return new FieldDefinition(name, type, description, required, enumValues, regex, minLength, maxLength, minimum, maximum);
    }
}
