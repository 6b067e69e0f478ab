package com.eainde.langextract.extraction;

import com.eainde.langextract.LangExtractException;

/**
 * Model output could not be read as an extraction payload.
 */
public class ResponseParseException extends LangExtractException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
