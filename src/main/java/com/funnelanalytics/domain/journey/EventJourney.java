package com.funnelanalytics.domain.journey;

import lombok.Value;

import java.util.List;

@Value
public class EventJourney {

    List<EventPath> paths;
    EventJourneyStats stats;

    public static EventJourney empty() {
        return new EventJourney(List.of(), EventJourneyStats.empty());
    }
}
