package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Condition on one event parameter of the hit being evaluated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParamFilter {

    private String key;

    @Builder.Default
    private ParamOperator operator = ParamOperator.EQUALS;

    private String value;
}
