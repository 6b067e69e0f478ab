package com.eainde.langextract.provider;

import com.eainde.langextract.LangExtractException;

/**
 * A language model call failed.
 */
public class ProviderException extends LangExtractException {

    private final ProviderErrorType type;
    private final String provider;

    public ProviderException(ProviderErrorType type, String provider, String message) {
        super(message);
        this.type = type;
        this.provider = provider;
    }

    public ProviderException(ProviderErrorType type, String provider, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.provider = provider;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public String getProvider() {
        return provider;
    }

    public boolean isRecoverable() {
        return type.isRecoverable();
    }
}
