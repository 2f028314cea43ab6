package com.funnelanalytics.domain.model;

/**
 * Analysis kinds, used for audit labels, metrics tags, cache prefixes and async jobs.
 */
public enum AnalysisType {
    FUNNEL("funnel"),
    FUNNEL_TIMING("funnel_timing"),
    JOURNEY("journey"),
    EVENT_JOURNEY("event_journey");

    private final String label;

    AnalysisType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
