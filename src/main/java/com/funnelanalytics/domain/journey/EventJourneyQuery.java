package com.funnelanalytics.domain.journey;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.pattern.ValuePattern;
import lombok.Value;

import java.util.Set;

@Value
public class EventJourneyQuery {

    AnalysisWindow window;

    /** Page the events must fire on, {@code null} for the whole site. */
    ValuePattern page;

    /** Fewest events, after collapsing repeats, a session needs to count. */
    int minEvents;

    /** Sessions must contain at least one of these events. Empty keeps every session. */
    Set<String> eventFilter;

    public boolean coversPage(String pageContext) {
        return page == null || page.matches(pageContext);
    }
}
