package com.dataset_analyzer.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analysis strategy selected for a run.
 */
public enum Route {
    ML("ml"),
    EDA("eda");

    private final String code;

    Route(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
