package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.model.TimingResult;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Timestamps at which one session matched the leading steps of a timing pattern.
 * Holds fewer timestamps than steps when the session dropped out.
 */
@Value
public class SessionTimingMatch {

    static final String TOTAL_LABEL = "Total";

    List<String> stepValues;
    List<Instant> matchedTimestamps;

    public static SessionTimingMatch none(List<String> stepValues) {
        return new SessionTimingMatch(stepValues, List.of());
    }

    public boolean isMatched() {
        return !matchedTimestamps.isEmpty();
    }

    public boolean isComplete() {
        return matchedTimestamps.size() == stepValues.size();
    }

    public List<TransitionRecord> transitions() {
        List<TransitionRecord> records = new ArrayList<>();
        for (int i = 0; i + 1 < matchedTimestamps.size(); i++) {
            records.add(new TransitionRecord(
                    i,
                    stepValues.get(i),
                    stepValues.get(i + 1),
                    seconds(matchedTimestamps.get(i), matchedTimestamps.get(i + 1))));
        }

        if (isComplete() && matchedTimestamps.size() > 1) {
            records.add(new TransitionRecord(
                    TimingResult.TOTAL_STEP,
                    TOTAL_LABEL,
                    TOTAL_LABEL,
                    seconds(matchedTimestamps.get(0), matchedTimestamps.get(matchedTimestamps.size() - 1))));
        }
        return records;
    }

    private static long seconds(Instant from, Instant to) {
        return Math.round(Duration.between(from, to).toMillis() / 1000.0);
    }
}
