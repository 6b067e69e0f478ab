package com.eainde.langextract.provider;

/**
 * Classification of a failed provider call. Drives the gateway's retry and failover policy.
 */
public enum ProviderErrorType {
    TIMEOUT(true),
    RATE_LIMIT(true),
    SERVER_ERROR(true),
    AUTHENTICATION(false),
    INVALID_REQUEST(false),
    UNAVAILABLE(true),
    UNKNOWN(true);

    private final boolean recoverable;

    ProviderErrorType(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
