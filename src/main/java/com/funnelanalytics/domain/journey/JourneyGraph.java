package com.funnelanalytics.domain.journey;

import lombok.Value;

import java.util.List;

@Value
public class JourneyGraph {

    List<JourneyNode> nodes;
    List<JourneyEdge> links;

    public static JourneyGraph empty() {
        return new JourneyGraph(List.of(), List.of());
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }
}
