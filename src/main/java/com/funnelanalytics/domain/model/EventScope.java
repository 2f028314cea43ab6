package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where an event step may fire relative to the previous step.
 */
public enum EventScope {
    /** Event must fire on the same normalized page as the previous step's match. */
    CURRENT_PATH("current-path"),
    ANYWHERE("anywhere");

    private final String json;

    EventScope(String json) {
        this.json = json;
    }

    @JsonValue
    public String getJson() {
        return json;
    }

    @JsonCreator
    public static EventScope fromJson(String value) {
        for (EventScope scope : values()) {
            if (scope.json.equalsIgnoreCase(value)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown event scope: " + value);
    }
}
