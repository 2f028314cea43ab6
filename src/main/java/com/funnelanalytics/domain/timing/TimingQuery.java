package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.EntryMode;
import lombok.Value;

import java.util.List;

/**
 * Validated funnel timing request: URL step values only.
 */
@Value
public class TimingQuery {

    AnalysisWindow window;
    List<String> stepValues;
    EntryMode mode;
}
