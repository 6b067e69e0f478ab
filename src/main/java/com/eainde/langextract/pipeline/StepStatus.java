package com.eainde.langextract.pipeline;

import java.util.Locale;

public enum StepStatus {
    SUCCESS,
    WARNING,
    ERROR,
    SKIPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
