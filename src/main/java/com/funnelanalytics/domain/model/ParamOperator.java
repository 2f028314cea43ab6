package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParamOperator {
    EQUALS("equals"),
    CONTAINS("contains");

    private final String json;

    ParamOperator(String json) {
        this.json = json;
    }

    @JsonValue
    public String getJson() {
        return json;
    }

    @JsonCreator
    public static ParamOperator fromJson(String value) {
        for (ParamOperator operator : values()) {
            if (operator.json.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown parameter operator: " + value);
    }

    public boolean matches(String actual, String expected) {
        if (actual == null || expected == null) {
            return false;
        }
        return this == CONTAINS ? actual.contains(expected) : actual.equals(expected);
    }
}
