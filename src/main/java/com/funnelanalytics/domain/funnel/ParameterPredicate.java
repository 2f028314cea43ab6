package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.ParamFilter;
import lombok.Value;

/**
 * The evaluated hit itself carries a parameter satisfying the filter.
 */
@Value
public class ParameterPredicate implements StagePredicate {

    ParamFilter filter;
    String keyParameterName;
    String valueParameterName;

    @Override
    public boolean test(StageCandidate candidate) {
        return candidate.hit().parameterValues(filter.getKey()).stream()
                .anyMatch(actual -> filter.getOperator().matches(actual, filter.getValue()));
    }
}
