package com.funnelanalytics.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Request body for funnel counts and funnel timing.
 *
 * Older dashboard builds send {@code urls} (plain paths) instead of {@code steps};
 * those are read as URL steps when {@code steps} is absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelRequest {

    @NotNull
    private UUID websiteId;

    @NotBlank
    private String startDate;

    @NotBlank
    private String endDate;

    @Builder.Default
    private Boolean onlyDirectEntry = Boolean.TRUE;

    @Valid
    private List<StepDefinition> steps;

    private List<String> urls;

    public List<StepDefinition> resolveSteps() {
        if (steps != null) {
            return steps;
        }
        if (urls != null) {
            return urls.stream().map(StepDefinition::url).collect(Collectors.toList());
        }
        return List.of();
    }

    public EntryMode entryMode() {
        return EntryMode.fromDirectEntry(onlyDirectEntry);
    }
}
