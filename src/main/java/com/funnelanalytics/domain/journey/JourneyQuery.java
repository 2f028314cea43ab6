package com.funnelanalytics.domain.journey;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.JourneyDirection;
import lombok.Value;

@Value
public class JourneyQuery {

    AnalysisWindow window;

    /** Normalized start page. */
    String startUrl;

    JourneyDirection direction;

    /** Relative steps explored from the start page. */
    int horizon;

    /** Edges kept per relative step. */
    int edgeCap;
}
