package com.funnelanalytics.domain.journey;

import lombok.Value;

/**
 * Weighted page transition at one relative step, before node ids are assigned.
 */
@Value
public class JourneyFlow {

    int step;
    String source;
    String target;
    long weight;
}
