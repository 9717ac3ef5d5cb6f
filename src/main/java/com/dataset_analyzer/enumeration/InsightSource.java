package com.dataset_analyzer.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InsightSource {
    GENERATED("generated"),
    FALLBACK("fallback");

    private final String code;

    InsightSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
