package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;

/**
 * Whether a journey follows visitors after the start page or leads up to it.
 */
public enum JourneyDirection {
    FORWARD,
    BACKWARD;

    public static JourneyDirection fromJson(String value) {
        if (value == null || value.isBlank() || "forward".equalsIgnoreCase(value)) {
            return FORWARD;
        }
        if ("backward".equalsIgnoreCase(value)) {
            return BACKWARD;
        }
        throw new InvalidAnalysisRequestException("direction must be 'forward' or 'backward', got: " + value);
    }
}
