package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.model.EntryMode;
import com.funnelanalytics.domain.model.NormalizedHit;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Matches one session's pageviews against an ordered list of exact paths.
 *
 * Step 0 anchors on the first hit with that path. Each later step either has to be
 * the very next hit (strict) or the first equal hit after the previous match (loose).
 * The first step that cannot be matched ends the session's chain; nothing is revisited.
 */
@Component
public class SessionTimingMatcher {

    public SessionTimingMatch match(List<NormalizedHit> hits, List<String> stepValues, EntryMode mode) {
        if (hits == null || hits.isEmpty() || stepValues == null || stepValues.size() < 2) {
            return SessionTimingMatch.none(stepValues == null ? List.of() : stepValues);
        }

        int lastMatchedIndex = -1;
        for (int i = 0; i < hits.size(); i++) {
            if (stepValues.get(0).equals(hits.get(i).getPathOrName())) {
                lastMatchedIndex = i;
                break;
            }
        }
        if (lastMatchedIndex < 0) {
            return SessionTimingMatch.none(stepValues);
        }

        List<Instant> timestamps = new ArrayList<>(stepValues.size());
        timestamps.add(hits.get(lastMatchedIndex).getTimestamp());

        for (int step = 1; step < stepValues.size(); step++) {
            int found = mode == EntryMode.STRICT
                    ? nextIfEqual(hits, lastMatchedIndex, stepValues.get(step))
                    : firstEqualAfter(hits, lastMatchedIndex, stepValues.get(step));
            if (found < 0) {
                break;
            }
            lastMatchedIndex = found;
            timestamps.add(hits.get(found).getTimestamp());
        }

        return new SessionTimingMatch(stepValues, List.copyOf(timestamps));
    }

    private int nextIfEqual(List<NormalizedHit> hits, int lastMatchedIndex, String target) {
        int next = lastMatchedIndex + 1;
        return next < hits.size() && target.equals(hits.get(next).getPathOrName()) ? next : -1;
    }

    private int firstEqualAfter(List<NormalizedHit> hits, int lastMatchedIndex, String target) {
        for (int i = lastMatchedIndex + 1; i < hits.size(); i++) {
            if (target.equals(hits.get(i).getPathOrName())) {
                return i;
            }
        }
        return -1;
    }
}
