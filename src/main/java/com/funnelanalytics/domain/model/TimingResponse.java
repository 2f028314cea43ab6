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
public class TimingResponse {

    private List<TimingResult> data;
    private QueryStats queryStats;
    private String sql;
    private boolean cached;
    private long queryTimeMs;
}
