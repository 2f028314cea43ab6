package com.funnelanalytics.domain.journey;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A page at one relative step. The same page at two steps is two nodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JourneyNode {

    private int id;

    /** {@code "<step>:<page>"} */
    private String nodeId;

    private int stepIndex;
    private String name;
}
