package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Distinct sessions reaching one funnel step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class FunnelStepResult {

    private int step;
    private String value;
    private StepKind type;
    private List<ParamFilter> params;
    private long count;
}
