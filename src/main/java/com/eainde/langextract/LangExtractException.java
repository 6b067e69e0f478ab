package com.eainde.langextract;

/**
 * Root of every exception raised by the extraction pipeline and its collaborators.
 */
public class LangExtractException extends RuntimeException {

    public LangExtractException(String message) {
        super(message);
    }

    public LangExtractException(String message, Throwable cause) {
        super(message, cause);
    }
}
