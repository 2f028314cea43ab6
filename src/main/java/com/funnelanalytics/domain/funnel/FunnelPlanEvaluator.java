package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.FunnelStepResult;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.model.StepDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs a {@link FunnelQueryPlan} over session hit streams held in memory.
 *
 * Each stage takes the earliest qualifying hit of a session (first occurrence wins),
 * and the next stage is evaluated against that match. A session that misses a stage
 * is not considered for any later one.
 */
@Component
public class FunnelPlanEvaluator {

    public List<FunnelStepResult> evaluate(FunnelQueryPlan plan, Collection<SessionHits> sessions) {
        long[] counts = new long[plan.stageCount()];

        for (SessionHits session : sessions) {
            int reached = stagesReached(plan, session.getHits());
            for (int stage = 0; stage < reached; stage++) {
                counts[stage]++;
            }
        }

        List<FunnelStepResult> results = new ArrayList<>(plan.stageCount());
        for (FilterStage stage : plan.getStages()) {
            StepDefinition step = stage.getStep();
            results.add(FunnelStepResult.builder()
                    .step(stage.getIndex())
                    .value(step.getValue())
                    .type(step.getKind())
                    .params(step.hasParamFilters() ? step.getParamFilters() : null)
                    .count(counts[stage.getIndex()])
                    .build());
        }
        return results;
    }

    /**
     * Number of leading stages the session satisfies.
     */
    int stagesReached(FunnelQueryPlan plan, List<NormalizedHit> hits) {
        StageMatch previous = null;
        int reached = 0;

        for (FilterStage stage : plan.getStages()) {
            StageMatch match = firstMatch(stage, hits, previous);
            if (match == null) {
                break;
            }
            previous = match;
            reached++;
        }
        return reached;
    }

    private StageMatch firstMatch(FilterStage stage, List<NormalizedHit> hits, StageMatch previous) {
        for (int index = 0; index < hits.size(); index++) {
            if (stage.accepts(new StageCandidate(hits, index, previous))) {
                return StageMatch.of(index, hits.get(index));
            }
        }
        return null;
    }
}
