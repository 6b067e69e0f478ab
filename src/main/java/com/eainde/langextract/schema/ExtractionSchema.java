package com.eainde.langextract.schema;

import com.eainde.langextract.extraction.Extraction;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Structure and constraints for extractions.
 *
 * <p>The pipeline only depends on {@link #validateExtraction(Extraction)} during its
 * validation stage; the other methods feed prompt building and structured responses.</p>
 */
public interface ExtractionSchema {

    String getName();

    String getDescription();

    List<String> getClasses();

    /**
     * @throws SchemaValidationException if the extraction violates the schema
     */
    void validateExtraction(Extraction extraction);

    /**
     * JSON Schema (draft-07) describing the expected model response.
     */
    ObjectNode toJsonSchema();
}
