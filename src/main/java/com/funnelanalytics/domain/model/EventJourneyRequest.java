package com.funnelanalytics.domain.model;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Request body for event journeys: which sequences of custom events sessions fired on a page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventJourneyRequest {

    @NotNull
    private UUID websiteId;

    @NotBlank
    private String startDate;

    @NotBlank
    private String endDate;

    /** Page the events fired on, {@code *} allowed. Blank covers the whole site. */
    private String urlPath;

    @Min(1)
    @Builder.Default
    private Integer minEvents = 1;

    /** Event names; only sessions firing one of them are counted. */
    @Builder.Default
    private List<String> eventFilter = new ArrayList<>();
}
