package com.eainde.langextract;

/**
 * A request was cancelled or ran past its deadline.
 */
public class RequestCancelledException extends LangExtractException {

    public enum Reason {
        CANCELED,
        DEADLINE_EXCEEDED
    }

    private final Reason reason;

    public RequestCancelledException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
