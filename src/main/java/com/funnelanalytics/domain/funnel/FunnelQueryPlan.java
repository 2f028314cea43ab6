package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.EntryMode;
import com.funnelanalytics.domain.pattern.StepPattern;
import com.funnelanalytics.infrastructure.warehouse.HitStreamRequest;
import lombok.Value;

import java.util.List;

/**
 * Intermediate form between a step pattern and any executable query: a chain of stages,
 * each depending on the one before it.
 */
@Value
public class FunnelQueryPlan {

    AnalysisWindow window;
    EntryMode mode;
    StepPattern pattern;
    List<FilterStage> stages;

    public HitStreamRequest hitStreamRequest() {
        if (pattern.requiresParameters()) {
            return HitStreamRequest.withParameterKeys(window, pattern.requiredHitKinds(), pattern.parameterKeys());
        }
        return HitStreamRequest.of(window, pattern.requiredHitKinds(), false);
    }

    public int stageCount() {
        return stages.size();
    }
}
