package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.QueryStats;
import com.funnelanalytics.infrastructure.audit.QueryAuditLogger;
import com.funnelanalytics.infrastructure.persistence.entity.QueryAuditEntity.QueryMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Estimates scan size as rows in the window times the average row size, priced per TiB.
 *
 * A failed estimate is logged and reported as unknown ({@code null}); it never blocks the analysis.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WarehouseDryRunEstimator implements QueryCostEstimator {

    private static final double BYTES_PER_GIB = 1024d * 1024 * 1024;
    private static final double BYTES_PER_TIB = BYTES_PER_GIB * 1024;

    private final HitStreamProvider hitStreamProvider;
    private final QueryAuditLogger auditLogger;
    private final WarehouseProperties properties;

    @Override
    public QueryStats estimate(HitStreamRequest request, AnalysisType analysisType, String userIdent, String queryText) {
        try {
            auditLogger.record(userIdent, analysisType, QueryMode.DRY_RUN,
                    request.getWindow().getWebsiteId(), queryText);

            long rows = hitStreamProvider.countHits(request);
            long bytes = rows * properties.getAverageRowBytes();

            QueryStats stats = QueryStats.builder()
                    .totalBytesProcessed(bytes)
                    .totalBytesProcessedGB(String.format(Locale.ROOT, "%.2f", bytes / BYTES_PER_GIB))
                    .estimatedCostUSD(String.format(Locale.ROOT, "%.3f", bytes / BYTES_PER_TIB * properties.getCostPerTibUsd()))
                    .build();

            log.info("[{}] Dry run - processing {} GB, estimated cost: ${}",
                    analysisType.getLabel(), stats.getTotalBytesProcessedGB(), stats.getEstimatedCostUSD());
            return stats;

        } catch (RuntimeException e) {
            log.warn("[{}] Dry run failed: {}", analysisType.getLabel(), e.getMessage());
            return null;
        }
    }
}
