package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a funnel step is matched against: a visited URL path or a named custom event.
 */
public enum StepKind {
    URL("url", HitKind.PAGEVIEW),
    EVENT("event", HitKind.EVENT);

    private final String json;
    private final HitKind hitKind;

    StepKind(String json, HitKind hitKind) {
        this.json = json;
        this.hitKind = hitKind;
    }

    @JsonValue
    public String getJson() {
        return json;
    }

    /**
     * Hit kind a step of this kind is compared with.
     */
    public HitKind getHitKind() {
        return hitKind;
    }

    @JsonCreator
    public static StepKind fromJson(String value) {
        for (StepKind kind : values()) {
            if (kind.json.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown step type: " + value);
    }
}
