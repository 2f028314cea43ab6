package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One step of a funnel or journey pattern as sent by the dashboard.
 *
 * JSON shape: {@code {"type": "url"|"event", "value": "...", "eventScope": "...", "params": [...]}}.
 * Scope and parameter filters only mean something for event steps.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepDefinition {

    @JsonProperty("type")
    private StepKind kind;

    private String value;

    private EventScope eventScope;

    @JsonProperty("params")
    @Builder.Default
    private List<ParamFilter> paramFilters = new ArrayList<>();

    public static StepDefinition url(String value) {
        return StepDefinition.builder().kind(StepKind.URL).value(value).build();
    }

    public static StepDefinition event(String name) {
        return StepDefinition.builder().kind(StepKind.EVENT).value(name).build();
    }

    @JsonIgnore
    public boolean isEvent() {
        return kind == StepKind.EVENT;
    }

    @JsonIgnore
    public boolean isScopedToCurrentPath() {
        return isEvent() && eventScope == EventScope.CURRENT_PATH;
    }

    @JsonIgnore
    public boolean hasParamFilters() {
        return isEvent() && paramFilters != null && !paramFilters.isEmpty();
    }
}
