package com.eainde.langextract.alignment;

import com.eainde.langextract.LangExtractException;

/**
 * Invalid alignment input, such as bad options or an interval outside the source text.
 */
public class AlignmentException extends LangExtractException {

    public AlignmentException(String message) {
        super(message);
    }
}
