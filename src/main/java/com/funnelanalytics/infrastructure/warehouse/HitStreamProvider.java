package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.domain.model.SessionHits;

import java.util.List;

/**
 * Source of per-session hit streams.
 *
 * Implementations enforce the scan limit and throw
 * {@link com.funnelanalytics.domain.exception.QueryResourceLimitException} when it is exceeded,
 * or {@link com.funnelanalytics.domain.exception.WarehouseUnavailableException} when the store cannot be reached.
 */
public interface HitStreamProvider {

    /**
     * Sessions with at least one matching hit, each ordered chronologically. Empty when nothing matched.
     */
    List<SessionHits> fetchSessions(HitStreamRequest request);

    /**
     * Rows the request would scan: hit rows, plus parameter rows when parameters are attached.
     */
    long countHits(HitStreamRequest request);
}
