package com.eainde.langextract.pipeline;

import com.eainde.langextract.LangExtractException;

/**
 * The request is malformed: missing text, blank task description and the like.
 */
public class RequestValidationException extends LangExtractException {

    public RequestValidationException(String message) {
        super(message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
