package com.eainde.langextract.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An extraction class the schema accepts, with its class-specific attribute fields.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("fields") List<FieldDefinition> fields
) {

    public ClassDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static ClassDefinition of(String name, FieldDefinition... fields) {
        return new ClassDefinition(name, null, List.of(fields));
    }
}
