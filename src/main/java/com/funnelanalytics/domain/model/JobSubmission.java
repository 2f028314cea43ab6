package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Async job body: the analysis kind and the request it would take synchronously.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmission {

    @NotNull
    private AnalysisType queryType;

    @NotNull
    private JsonNode request;
}
