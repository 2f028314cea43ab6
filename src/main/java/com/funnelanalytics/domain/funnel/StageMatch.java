package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.NormalizedHit;
import lombok.Value;

import java.time.Instant;

/**
 * Earliest hit that satisfied a stage for one session.
 */
@Value
public class StageMatch {

    int hitIndex;
    Instant timestamp;
    String pageContext;

    static StageMatch of(int hitIndex, NormalizedHit hit) {
        return new StageMatch(hitIndex, hit.getTimestamp(), hit.getPageContext());
    }
}
