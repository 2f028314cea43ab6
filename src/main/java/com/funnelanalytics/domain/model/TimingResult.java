package com.funnelanalytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Elapsed-time statistics for one step transition, or for the whole funnel
 * when {@code fromStep} is {@link #TOTAL_STEP}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimingResult {

    public static final int TOTAL_STEP = -1;

    private int fromStep;
    private int toStep;
    private String fromValue;
    private String toValue;
    private double avgSeconds;
    private long medianSeconds;
    private long sampleCount;
}
