package com.eainde.langextract.provider;

import java.util.List;

/**
 * Every configured provider was tried and none produced a response.
 */
public class ProvidersExhaustedException extends ProviderException {

    private final List<FailoverEvent> failoverEvents;

    public ProvidersExhaustedException(String message, ProviderException lastError, List<FailoverEvent> failoverEvents) {
        super(lastError == null ? ProviderErrorType.UNAVAILABLE : lastError.getType(),
                lastError == null ? null : lastError.getProvider(), message, lastError);
        this.failoverEvents = List.copyOf(failoverEvents);
    }

    public List<FailoverEvent> getFailoverEvents() {
        return failoverEvents;
    }
}
