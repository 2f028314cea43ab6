package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.pattern.ValuePattern;
import lombok.Value;

/**
 * Path (pageview) or event name matches the stage's value pattern.
 */
@Value
public class StepValuePredicate implements StagePredicate {

    ValuePattern pattern;
    String parameterName;

    @Override
    public boolean test(StageCandidate candidate) {
        return pattern.matches(candidate.hit().getPathOrName());
    }
}
