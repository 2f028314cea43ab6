package com.funnelanalytics.domain.model;

/**
 * Recorded hit types, with the numeric code the tracker stores in {@code event_type}.
 */
public enum HitKind {
    PAGEVIEW(1),
    EVENT(2);

    private final int code;

    HitKind(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static HitKind fromCode(int code) {
        for (HitKind kind : values()) {
            if (kind.code == code) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event type code: " + code);
    }
}
