package com.funnelanalytics.domain.pattern;

import com.funnelanalytics.domain.exception.InvalidStepPatternException;
import com.funnelanalytics.domain.model.EventScope;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.ParamFilter;
import com.funnelanalytics.domain.model.ParamOperator;
import com.funnelanalytics.domain.model.StepDefinition;
import com.funnelanalytics.domain.model.StepKind;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validated, ordered list of funnel steps.
 *
 * Construction trims values, drops blank steps and normalizes URL values.
 * Scope and parameter filters are cleared where they cannot apply (URL steps, and scope on the first step).
 * Fewer than two usable steps is rejected.
 */
@ToString
@EqualsAndHashCode
public final class StepPattern {

    public static final int MIN_STEPS = 2;

    private final List<StepDefinition> steps;

    private StepPattern(List<StepDefinition> steps) {
        this.steps = Collections.unmodifiableList(steps);
    }

    public static StepPattern of(List<StepDefinition> input) {
        if (input == null) {
            throw new InvalidStepPatternException("At least " + MIN_STEPS + " steps are required for a funnel");
        }

        List<StepDefinition> usable = new ArrayList<>();
        for (int i = 0; i < input.size(); i++) {
            StepDefinition step = input.get(i);
            if (step == null || step.getValue() == null || step.getValue().isBlank()) {
                continue;
            }
            if (step.getKind() == null) {
                throw new InvalidStepPatternException("Step " + i + " is missing its type");
            }
            usable.add(canonical(step, usable.isEmpty()));
        }

        if (usable.size() < MIN_STEPS) {
            throw new InvalidStepPatternException("At least " + MIN_STEPS + " steps are required for a funnel");
        }
        return new StepPattern(usable);
    }

    private static StepDefinition canonical(StepDefinition step, boolean first) {
        String value = step.getValue().trim();

        if (step.getKind() == StepKind.URL) {
            return StepDefinition.url(UrlPathNormalizer.normalize(value));
        }

        List<ParamFilter> filters = new ArrayList<>();
        if (step.getParamFilters() != null) {
            for (ParamFilter filter : step.getParamFilters()) {
                if (filter == null || filter.getKey() == null || filter.getKey().isBlank()) {
                    throw new InvalidStepPatternException("Parameter filter on event '" + value + "' is missing its key");
                }
                filters.add(ParamFilter.builder()
                        .key(filter.getKey().trim())
                        .operator(filter.getOperator() == null ? ParamOperator.EQUALS : filter.getOperator())
                        .value(filter.getValue() == null ? "" : filter.getValue())
                        .build());
            }
        }

        return StepDefinition.builder()
                .kind(StepKind.EVENT)
                .value(value)
                .eventScope(first ? null : (step.getEventScope() == null ? EventScope.ANYWHERE : step.getEventScope()))
                .paramFilters(filters)
                .build();
    }

    public int size() {
        return steps.size();
    }

    public StepDefinition get(int index) {
        return steps.get(index);
    }

    public List<StepDefinition> steps() {
        return steps;
    }

    public List<String> values() {
        return steps.stream().map(StepDefinition::getValue).collect(Collectors.toList());
    }

    public boolean isUrlOnly() {
        return steps.stream().allMatch(step -> step.getKind() == StepKind.URL);
    }

    public Set<HitKind> requiredHitKinds() {
        Set<HitKind> kinds = EnumSet.noneOf(HitKind.class);
        steps.forEach(step -> kinds.add(step.getKind().getHitKind()));
        return kinds;
    }

    public boolean requiresParameters() {
        return steps.stream().anyMatch(StepDefinition::hasParamFilters);
    }

    /**
     * Parameter keys any step filters on, in first-use order.
     */
    public Set<String> parameterKeys() {
        Set<String> keys = new LinkedHashSet<>();
        steps.stream()
                .filter(StepDefinition::hasParamFilters)
                .flatMap(step -> step.getParamFilters().stream())
                .forEach(filter -> keys.add(filter.getKey()));
        return keys;
    }
}
