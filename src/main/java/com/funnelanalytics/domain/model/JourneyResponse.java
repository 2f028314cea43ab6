package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.journey.JourneyEdge;
import com.funnelanalytics.domain.journey.JourneyNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneyResponse {

    private List<JourneyNode> nodes;
    private List<JourneyEdge> links;
    private QueryStats queryStats;
    private boolean cached;
    private long queryTimeMs;
}
