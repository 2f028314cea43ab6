package com.funnelanalytics.domain.journey;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What sessions visiting the page did there. The last three counts partition {@code totalSessions}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventJourneyStats {

    /** Sessions with a pageview of the page. */
    private long totalSessions;

    /** Of those, sessions that fired at least one event on it. */
    private long sessionsWithEvents;

    /** Sessions without events that went on to another pageview. */
    private long sessionsNoEventsNavigated;

    /** Sessions without events and without a later pageview. */
    private long sessionsNoEventsBounced;

    public static EventJourneyStats empty() {
        return new EventJourneyStats();
    }
}
