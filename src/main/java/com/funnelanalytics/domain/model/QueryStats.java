package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dry-run cost estimate attached to analysis responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryStats {

    private long totalBytesProcessed;
    private String totalBytesProcessedGB;
    private String estimatedCostUSD;
}
