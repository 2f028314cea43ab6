package com.funnelanalytics.domain.funnel;

import lombok.Value;

/**
 * Hit is strictly later than the previous stage's match.
 */
@Value
public class AfterPreviousStagePredicate implements StagePredicate {

    String previousStage;

    @Override
    public boolean test(StageCandidate candidate) {
        return candidate.getPrevious() != null
                && candidate.hit().getTimestamp().isAfter(candidate.getPrevious().getTimestamp());
    }
}
