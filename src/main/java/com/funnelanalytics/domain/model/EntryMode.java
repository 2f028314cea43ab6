package com.funnelanalytics.domain.model;

/**
 * Ordering discipline between consecutive steps.
 */
public enum EntryMode {
    /** The match for a step must directly follow a hit matching the previous step. */
    STRICT,
    /** Any later hit may match; other hits may intervene. */
    LOOSE;

    public static EntryMode fromDirectEntry(Boolean onlyDirectEntry) {
        return onlyDirectEntry == null || onlyDirectEntry ? STRICT : LOOSE;
    }
}
