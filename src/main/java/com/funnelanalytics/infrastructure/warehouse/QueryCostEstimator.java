package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.QueryStats;

/**
 * Dry run: estimates what an analysis will scan without reading the hits.
 */
public interface QueryCostEstimator {

    /**
     * @return the estimate, or {@code null} when it could not be made; never throws
     */
    QueryStats estimate(HitStreamRequest request, AnalysisType analysisType, String userIdent, String queryText);
}
