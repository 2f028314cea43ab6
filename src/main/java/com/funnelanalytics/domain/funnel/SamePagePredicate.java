package com.funnelanalytics.domain.funnel;

import lombok.Value;

import java.util.Objects;

/**
 * Event fired on the page the previous stage matched on.
 * Compares against the page at the moment of that match only.
 */
@Value
public class SamePagePredicate implements StagePredicate {

    String previousStage;

    @Override
    public boolean test(StageCandidate candidate) {
        return candidate.getPrevious() != null
                && Objects.equals(candidate.hit().getPageContext(), candidate.getPrevious().getPageContext());
    }
}
