package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.model.TimingResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds per-session transition records into one {@link TimingResult} per step pair.
 *
 * Mean is arithmetic. Median is the lower middle element of the sorted sample
 * (nearest rank, no interpolation). Output is ordered by step with the total row first,
 * and is independent of the order records arrive in.
 */
@Component
public class TimingAggregator {

    public List<TimingResult> aggregate(Collection<TransitionRecord> records) {
        Map<Integer, List<TransitionRecord>> byStep = new TreeMap<>();
        for (TransitionRecord record : records) {
            byStep.computeIfAbsent(record.getStep(), step -> new ArrayList<>()).add(record);
        }

        List<TimingResult> results = new ArrayList<>(byStep.size());
        for (Map.Entry<Integer, List<TransitionRecord>> entry : byStep.entrySet()) {
            List<TransitionRecord> group = entry.getValue();
            if (group.isEmpty()) {
                continue;
            }

            long[] diffs = group.stream().mapToLong(TransitionRecord::getDiffSeconds).sorted().toArray();
            long sum = 0;
            for (long diff : diffs) {
                sum += diff;
            }

            int step = entry.getKey();
            TransitionRecord first = group.get(0);
            results.add(TimingResult.builder()
                    .fromStep(step)
                    .toStep(step == TimingResult.TOTAL_STEP ? TimingResult.TOTAL_STEP : step + 1)
                    .fromValue(first.getFromValue())
                    .toValue(first.getToValue())
                    .avgSeconds((double) sum / diffs.length)
                    .medianSeconds(diffs[(diffs.length - 1) / 2])
                    .sampleCount(diffs.length)
                    .build());
        }
        return results;
    }
}
