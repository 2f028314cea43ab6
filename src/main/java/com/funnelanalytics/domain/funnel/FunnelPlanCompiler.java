package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.EntryMode;
import com.funnelanalytics.domain.model.ParamFilter;
import com.funnelanalytics.domain.model.StepDefinition;
import com.funnelanalytics.domain.pattern.StepPattern;
import com.funnelanalytics.domain.pattern.ValuePattern;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a step pattern into a {@link FunnelQueryPlan}.
 *
 * Stage i (named {@code step<i+1>}) accepts a hit when:
 * <ul>
 *   <li>its kind and value match step i,</li>
 *   <li>for i &gt; 0, it is later than stage i-1's match,</li>
 *   <li>for i &gt; 0 in strict mode, the hit right before it matches step i-1,</li>
 *   <li>for event steps scoped to the current path, it fired on the page of stage i-1's match,</li>
 *   <li>every parameter filter of an event step holds on it.</li>
 * </ul>
 */
@Component
public class FunnelPlanCompiler {

    public FunnelQueryPlan compile(StepPattern pattern, EntryMode mode, AnalysisWindow window) {
        List<FilterStage> stages = new ArrayList<>(pattern.size());

        for (int index = 0; index < pattern.size(); index++) {
            StepDefinition step = pattern.get(index);
            List<StagePredicate> predicates = new ArrayList<>();

            predicates.add(new HitKindPredicate(step.getKind().getHitKind()));
            predicates.add(new StepValuePredicate(ValuePattern.of(step.getValue()), valueParameter(index)));

            if (index > 0) {
                String previousStage = stageName(index - 1);
                StepDefinition previousStep = pattern.get(index - 1);

                predicates.add(new AfterPreviousStagePredicate(previousStage));
                if (mode == EntryMode.STRICT) {
                    predicates.add(new PrecededByPredicate(
                            previousStep.getKind().getHitKind(),
                            ValuePattern.of(previousStep.getValue()),
                            valueParameter(index - 1)));
                }
                if (step.isScopedToCurrentPath()) {
                    predicates.add(new SamePagePredicate(previousStage));
                }
            }

            if (step.hasParamFilters()) {
                List<ParamFilter> filters = step.getParamFilters();
                for (int filterIndex = 0; filterIndex < filters.size(); filterIndex++) {
                    predicates.add(new ParameterPredicate(
                            filters.get(filterIndex),
                            "step" + index + "_pKey" + filterIndex,
                            "step" + index + "_pVal" + filterIndex));
                }
            }

            stages.add(new FilterStage(index, stageName(index), step, List.copyOf(predicates)));
        }

        return new FunnelQueryPlan(window, mode, pattern, List.copyOf(stages));
    }

    static String stageName(int index) {
        return "step" + (index + 1);
    }

    static String valueParameter(int index) {
        return "stepValue" + index;
    }
}
