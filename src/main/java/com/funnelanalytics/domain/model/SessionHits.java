package com.funnelanalytics.domain.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All hits of one session inside the analysis window, ordered by timestamp then arrival.
 */
@Value
public class SessionHits {

    private static final Comparator<NormalizedHit> CHRONOLOGICAL =
            Comparator.comparing(NormalizedHit::getTimestamp).thenComparingLong(NormalizedHit::getSequence);

    String sessionId;
    List<NormalizedHit> hits;

    public static SessionHits of(String sessionId, List<NormalizedHit> hits) {
        List<NormalizedHit> ordered = new ArrayList<>(hits);
        ordered.sort(CHRONOLOGICAL);
        return new SessionHits(sessionId, List.copyOf(ordered));
    }

    public List<NormalizedHit> hitsOfKind(HitKind kind) {
        return hits.stream()
                .filter(hit -> hit.getKind() == kind)
                .collect(Collectors.toList());
    }

    public int size() {
        return hits.size();
    }
}
