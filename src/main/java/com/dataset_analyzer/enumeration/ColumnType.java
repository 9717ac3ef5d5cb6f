package com.dataset_analyzer.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ColumnType {
    NUMERIC("numeric"),
    TEXT("text"),
    BOOLEAN("boolean");

    private final String code;

    ColumnType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
