package com.eainde.langextract.schema;

import com.eainde.langextract.LangExtractException;

/**
 * An extraction does not conform to its schema.
 */
public class SchemaValidationException extends LangExtractException {

    private final String field;
    private final String constraint;
    private final String value;

    public SchemaValidationException(String field, String constraint, String value, String message) {
        super(message);
        this.field = field;
        this.constraint = constraint;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public String getConstraint() {
        return constraint;
    }

    public String getValue() {
        return value;
    }
}
