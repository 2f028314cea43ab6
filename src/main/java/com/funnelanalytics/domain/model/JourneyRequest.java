package com.funnelanalytics.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Request body for the journey (page flow) graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JourneyRequest {

    @NotNull
    private UUID websiteId;

    @NotBlank
    private String startUrl;

    @NotBlank
    private String startDate;

    @NotBlank
    private String endDate;

    /** Horizon: relative steps explored from the start page. */
    @Min(1)
    @Max(15)
    @Builder.Default
    private Integer steps = 3;

    /** Edges kept per relative step. */
    @Min(1)
    @Builder.Default
    private Integer limit = 30;

    @Builder.Default
    private String direction = "forward";
}
