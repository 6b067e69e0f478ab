package com.eainde.langextract.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses a model response into {@link Extraction}s.
 *
 * <h3>Accepted shape:</h3>
 * <pre>
 * { "extractions": [
 *     { "extraction_class": "PERSON", "extraction_text": "John Smith", "confidence": 0.9,
 *       "attributes": { "role": "engineer" }, "other": "kept as attribute" } ] }
 * </pre>
 *
 * <p>Markdown code fences and any prose around the outermost JSON object are stripped.
 * Items that are not objects, or lack a class or text, are skipped; a payload that is not
 * JSON or has no {@code extractions} array is a {@link ResponseParseException}.</p>
 */
public class ExtractionParser {

    private static final Logger log = LoggerFactory.getLogger(ExtractionParser.class);

    static final String CLASS_KEY = "extraction_class";
    static final String TEXT_KEY = "extraction_text";
    static final String CONFIDENCE_KEY = "confidence";
    static final String ATTRIBUTES_KEY = "attributes";

    private final ObjectMapper objectMapper;

    public ExtractionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param output     raw model text
     * @param groupIndex value stamped on every parsed extraction's group index
     * @return parsed extractions, indexed in response order from 0
     */
    public List<Extraction> parse(String output, int groupIndex) {
        if (output == null || output.isBlank()) {
            throw new ResponseParseException("model returned an empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(cleanJson(output));
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("model response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode items = root.get("extractions");
        if (items == null) {
            throw new ResponseParseException("no 'extractions' field found in response");
        }
        if (!items.isArray()) {
            throw new ResponseParseException("'extractions' field is not an array");
        }

        List<Extraction> extractions = new ArrayList<>(items.size());
        int skipped = 0;
        for (JsonNode item : items) {
            Extraction extraction = toExtraction(item);
            if (extraction == null) {
                skipped++;
                continue;
            }
            extraction.setExtractionIndex(extractions.size());
            extraction.setGroupIndex(groupIndex);
            extractions.add(extraction);
        }

        if (skipped > 0) {
            log.warn("Skipped {} incomplete extraction item(s) in model response", skipped);
        }
        log.debug("Parsed {} extraction(s) from model response", extractions.size());
        return extractions;
    }

    private Extraction toExtraction(JsonNode item) {
        if (!item.isObject()) {
            return null;
        }
        String extractionClass = text(item.get(CLASS_KEY));
        String extractionText = text(item.get(TEXT_KEY));
        if (extractionClass == null || extractionText == null) {
            return null;
        }

        Extraction extraction = new Extraction(extractionClass, extractionText);
        JsonNode confidence = item.get(CONFIDENCE_KEY);
        if (confidence != null && confidence.isNumber()) {
            extraction.setConfidence(confidence.asDouble());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (CLASS_KEY.equals(key) || TEXT_KEY.equals(key) || CONFIDENCE_KEY.equals(key)) {
                continue;
            }
            if (ATTRIBUTES_KEY.equals(key) && field.getValue().isObject()) {
                field.getValue().fields().forEachRemaining(
                        attr -> extraction.putAttribute(attr.getKey(), toValue(attr.getValue())));
            } else {
                extraction.putAttribute(key, toValue(field.getValue()));
            }
        }
        return extraction;
    }

    private Object toValue(JsonNode node) {
        return objectMapper.convertValue(node, Object.class);
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    /**
     * Removes Markdown fences and surrounding prose, keeping the outermost {@code {...}}.
     */
    static String cleanJson(String raw) {
        String cleaned = raw.replace("```json", "")
                .replace("```JSON", "")
                .replace("```", "")
                .trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return cleaned.substring(start, end + 1);
        }
        return cleaned;
    }
}
