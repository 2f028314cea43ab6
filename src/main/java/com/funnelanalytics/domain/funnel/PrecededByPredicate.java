package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.pattern.ValuePattern;
import lombok.Value;

/**
 * Direct entry: the hit immediately before the candidate in the session stream
 * matches the previous step's kind and value.
 */
@Value
public class PrecededByPredicate implements StagePredicate {

    HitKind previousKind;
    ValuePattern previousPattern;
    String previousParameterName;

    @Override
    public boolean test(StageCandidate candidate) {
        NormalizedHit preceding = candidate.precedingHit();
        return preceding != null
                && preceding.getKind() == previousKind
                && previousPattern.matches(preceding.getPathOrName());
    }
}
