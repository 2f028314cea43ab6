package com.funnelanalytics.domain.journey;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sessions moving between two nodes; {@code source}/{@code target} are node ids.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JourneyEdge {

    private int source;
    private int target;
    private long value;
}
