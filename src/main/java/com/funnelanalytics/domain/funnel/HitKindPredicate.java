package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.HitKind;
import lombok.Value;

@Value
public class HitKindPredicate implements StagePredicate {

    HitKind kind;

    @Override
    public boolean test(StageCandidate candidate) {
        return candidate.hit().getKind() == kind;
    }
}
