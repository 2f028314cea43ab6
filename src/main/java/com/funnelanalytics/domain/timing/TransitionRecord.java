package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.model.TimingResult;
import lombok.Value;

/**
 * Seconds one session spent between two consecutive matched steps,
 * or between the first and last step when {@code step} is {@link TimingResult#TOTAL_STEP}.
 */
@Value
public class TransitionRecord {

    int step;
    String fromValue;
    String toValue;
    long diffSeconds;

    public boolean isTotal() {
        return step == TimingResult.TOTAL_STEP;
    }
}
