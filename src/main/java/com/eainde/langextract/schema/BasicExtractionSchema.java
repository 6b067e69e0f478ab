package com.eainde.langextract.schema;

import com.eainde.langextract.extraction.Extraction;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Schema made of named classes with typed attribute fields, plus global fields shared by
 * every class.
 *
 * <h3>Validation rules, in order:</h3>
 * <ol>
 *   <li>the extraction class must be declared</li>
 *   <li>the extraction text must be non-empty</li>
 *   <li>every required field (global or class) must be present as an attribute</li>
 *   <li>every attribute with a field definition must satisfy its type and constraints;
 *       attributes without a definition are accepted as-is</li>
 * </ol>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BasicExtractionSchema implements ExtractionSchema {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("classes")
    private final List<ClassDefinition> classes;

    @JsonProperty("globalFields")
    private final List<FieldDefinition> globalFields;

    @JsonCreator
    public BasicExtractionSchema(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("classes") List<ClassDefinition> classes,
            @JsonProperty("globalFields") List<FieldDefinition> globalFields) {
        this.name = name;
        this.description = description;
        this.classes = classes == null ? List.of() : List.copyOf(classes);
        this.globalFields = globalFields == null ? List.of() : List.copyOf(globalFields);
    }

    public static BasicExtractionSchema of(String name, ClassDefinition... classes) {
        return new BasicExtractionSchema(name, null, List.of(classes), List.of());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    @JsonIgnore
    public List<String> getClasses() {
        return classes.stream().map(ClassDefinition::name).toList();
    }

    @JsonIgnore
    public List<ClassDefinition> getClassDefinitions() {
        return classes;
    }

    public List<FieldDefinition> getGlobalFields() {
        return globalFields;
    }

    public ClassDefinition getClassDefinition(String className) {
        return classes.stream()
                .filter(c -> c.name().equals(className))
                .findFirst()
                .orElse(null);
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Override
    public void validateExtraction(Extraction extraction) {
        if (extraction == null) {
            throw new SchemaValidationException("extraction", "not_null", null, "extraction cannot be null");
        }
        ClassDefinition classDef = getClassDefinition(extraction.getExtractionClass());
        if (classDef == null) {
            throw new SchemaValidationException("extraction_class", "known_class", extraction.getExtractionClass(),
                    "unknown extraction class: " + extraction.getExtractionClass());
        }
        if (extraction.getExtractionText().isEmpty()) {
            throw new SchemaValidationException("extraction_text", "not_empty", "",
                    "extraction text cannot be empty");
        }

        List<FieldDefinition> fields = new ArrayList<>(globalFields);
        fields.addAll(classDef.fields());

        Map<String, Object> attributes = extraction.getAttributes();
        for (FieldDefinition field : fields) {
            if (field.required() && !attributes.containsKey(field.name())) {
                throw new SchemaValidationException(field.name(), "required", null,
                        "required field " + field.name() + " is missing");
            }
        }
        for (Map.Entry<String, Object> attribute : attributes.entrySet()) {
            FieldDefinition field = findField(attribute.getKey(), fields);
            if (field != null) {
                validateFieldValue(field, attribute.getValue());
            }
        }
    }

    private static FieldDefinition findField(String fieldName, List<FieldDefinition> fields) {
        for (FieldDefinition field : fields) {
            if (field.name().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    private void validateFieldValue(FieldDefinition field, Object value) {
        String type = field.type() == null ? "" : field.type();
        switch (type) {
            case "string" -> {
                if (!(value instanceof String s)) {
                    throw typeMismatch(field, "string", value);
                }
                validateString(field, s);
            }
            case "number" -> {
                if (!(value instanceof Number n)) {
                    throw typeMismatch(field, "number", value);
                }
                validateNumber(field, n.doubleValue());
            }
            case "boolean" -> {
                if (!(value instanceof Boolean)) {
                    throw typeMismatch(field, "boolean", value);
                }
            }
            case "array" -> {
                if (!(value instanceof Collection<?>) && !(value != null && value.getClass().isArray())) {
                    throw typeMismatch(field, "array", value);
                }
            }
            default -> {
                // untyped field: presence is all that is checked
            }
        }
    }

    private void validateString(FieldDefinition field, String value) {
        if (field.minLength() != null && value.length() < field.minLength()) {
            throw new SchemaValidationException(field.name(), "minLength", value,
                    "field " + field.name() + ": string too short: " + value.length() + " < " + field.minLength());
        }
        if (field.maxLength() != null && value.length() > field.maxLength()) {
            throw new SchemaValidationException(field.name(), "maxLength", value,
                    "field " + field.name() + ": string too long: " + value.length() + " > " + field.maxLength());
        }
        if (!field.enumValues().isEmpty() && !field.enumValues().contains(value)) {
            throw new SchemaValidationException(field.name(), "enum", value,
                    "field " + field.name() + ": value \"" + value + "\" not in allowed values " + field.enumValues());
        }
        if (field.pattern() != null && !field.pattern().isEmpty()) {
            boolean matches;
            try {
                matches = Pattern.compile(field.pattern()).matcher(value).matches();
            } catch (PatternSyntaxException e) {
                throw new SchemaValidationException(field.name(), "pattern", field.pattern(),
                        "field " + field.name() + ": invalid pattern " + field.pattern());
            }
            if (!matches) {
                throw new SchemaValidationException(field.name(), "pattern", value,
                        "field " + field.name() + ": value \"" + value + "\" does not match " + field.pattern());
            }
        }
    }

    private void validateNumber(FieldDefinition field, double value) {
        if (field.minimum() != null && value < field.minimum()) {
            throw new SchemaValidationException(field.name(), "minimum", String.valueOf(value),
                    "field " + field.name() + ": number too small: " + value + " < " + field.minimum());
        }
        if (field.maximum() != null && value > field.maximum()) {
            throw new SchemaValidationException(field.name(), "maximum", String.valueOf(value),
                    "field " + field.name() + ": number too large: " + value + " > " + field.maximum());
        }
    }

    private static SchemaValidationException typeMismatch(FieldDefinition field, String expected, Object value) {
        String actual = value == null ? "null" : value.getClass().getSimpleName();
        return new SchemaValidationException(field.name(), "type", String.valueOf(value),
                "field " + field.name() + ": expected " + expected + ", got " + actual);
    }

    // =========================================================================
    //  JSON Schema
    // =========================================================================

    @Override
    public ObjectNode toJsonSchema() {
        ObjectNode item = NODES.objectNode();
        item.put("type", "object");
        ObjectNode itemProps = item.putObject("properties");

        ObjectNode classProp = itemProps.putObject("extraction_class");
        classProp.put("type", "string");
        ArrayNode classEnum = classProp.putArray("enum");
        getClasses().forEach(classEnum::add);

        itemProps.putObject("extraction_text").put("type", "string");
        itemProps.putObject("confidence").put("type", "number");

        List<FieldDefinition> allFields = new ArrayList<>(globalFields);
        classes.forEach(c -> c.fields().stream()
                .filter(f -> findField(f.name(), allFields) == null)
                .forEach(allFields::add));
        if (!allFields.isEmpty()) {
            ObjectNode attributes = itemProps.putObject("attributes");
            attributes.put("type", "object");
            ObjectNode attrProps = attributes.putObject("properties");
            allFields.forEach(f -> attrProps.set(f.name(), fieldSchema(f)));
        }
        ArrayNode itemRequired = item.putArray("required");
        itemRequired.add("extraction_class");
        itemRequired.add("extraction_text");

        ObjectNode root = NODES.objectNode();
        root.put("$schema", "http://json-schema.org/draft-07/schema#");
        root.put("type", "object");
        if (name != null) {
            root.put("title", name);
        }
        if (description != null) {
            root.put("description", description);
        }
        ObjectNode extractions = root.putObject("properties").putObject("extractions");
        extractions.put("type", "array");
        extractions.set("items", item);
        root.putArray("required").add("extractions");
        return root;
    }

    private static ObjectNode fieldSchema(FieldDefinition field) {
        ObjectNode node = NODES.objectNode();
        node.put("type", field.type() == null ? "string" : field.type());
        if (field.description() != null) {
            node.put("description", field.description());
        }
        if (!field.enumValues().isEmpty()) {
            ArrayNode values = node.putArray("enum");
            field.enumValues().forEach(values::add);
        }
        if ("array".equals(field.type())) {
            node.putObject("items").put("type", "string");
        }
        return node;
    }

    @Override
    public String toString() {
        return "BasicExtractionSchema{name=" + name + ", classes=" + getClasses() + "}";
    }
}
