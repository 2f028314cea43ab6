package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.journey.EventJourneyStats;
import com.funnelanalytics.domain.journey.EventPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventJourneyResponse {

    private List<EventPath> journeys;
    private EventJourneyStats journeyStats;
    private QueryStats queryStats;
    private boolean cached;
    private long queryTimeMs;
}
