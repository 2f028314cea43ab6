package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelResponse {

    private List<FunnelStepResult> data;
    private QueryStats queryStats;

    /** Parameter-substituted query, for operators only. */
    private String sql;

    private boolean cached;
    private long queryTimeMs;
}
