package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.domain.model.StepDefinition;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Named stage of a compiled funnel: "first hit satisfying all predicates".
 */
@Value
public class FilterStage {

    int index;
    String name;
    StepDefinition step;
    List<StagePredicate> predicates;

    public boolean accepts(StageCandidate candidate) {
        for (StagePredicate predicate : predicates) {
            if (!predicate.test(candidate)) {
                return false;
            }
        }
        return true;
    }

    public <T extends StagePredicate> List<T> predicatesOfType(Class<T> type) {
        return predicates.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }
}
