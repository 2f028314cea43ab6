package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.NormalizedHit;
import lombok.Value;

import java.util.List;

/**
 * A hit under evaluation for one stage, with its position in the session stream
 * and the match the previous stage settled on ({@code null} for the first stage).
 */
@Value
public class StageCandidate {

    List<NormalizedHit> sessionHits;
    int index;
    StageMatch previous;

    public NormalizedHit hit() {
        return sessionHits.get(index);
    }

    /**
     * Hit directly before the candidate in the session stream, or {@code null}.
     */
    public NormalizedHit precedingHit() {
        return index > 0 ? sessionHits.get(index - 1) : null;
    }
}
