package com.eainde.langextract.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts an {@link ExtractionSchema}'s JSON Schema into langchain4j's {@link JsonSchema}
 * so providers that support structured output can be asked for the extraction format directly.
 */
public final class ResponseSchemaConverter {

    private ResponseSchemaConverter() {
    }

    public static JsonSchema toResponseSchema(ExtractionSchema schema) {
        String name = schema.getName() != null && !schema.getName().isBlank()
                ? schema.getName().replaceAll("[^A-Za-z0-9_-]", "_")
                : "Extractions";
        return JsonSchema.builder()
                .name(name)
                .rootElement(parseElement(schema.toJsonSchema()))
                .build();
    }

    static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) return parseObject(node);
            return JsonStringSchema.builder().build();
        }

        return switch (node.get("type").asText()) {
            case "object" -> parseObject(node);
            case "array" -> parseArray(node);
            case "string" -> parseString(node);
            case "integer" -> JsonIntegerSchema.builder().description(description(node)).build();
            case "number" -> JsonNumberSchema.builder().description(description(node)).build();
            case "boolean" -> JsonBooleanSchema.builder().description(description(node)).build();
            default -> JsonStringSchema.builder().build();
        };
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }
        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }
        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder();
        if (node.has("description")) builder.description(node.get("description").asText());
        if (node.has("items")) {
            builder.items(parseElement(node.get("items")));
        }
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum") && node.get("enum").size() > 0) {
            List<String> values = new ArrayList<>();
            node.get("enum").forEach(n -> values.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(values)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
