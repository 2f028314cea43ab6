package com.funnelanalytics.infrastructure.audit;

import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.infrastructure.persistence.entity.QueryAuditEntity;
import com.funnelanalytics.infrastructure.persistence.entity.QueryAuditEntity.QueryMode;
import com.funnelanalytics.infrastructure.persistence.repository.QueryAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Records every warehouse query (dry runs included) with the user who triggered it.
 *
 * The stored query text carries a header comment with the user, timestamp, mode and
 * analysis type, so it reads the same way as the warehouse's own query history.
 * A failed audit write is logged and does not fail the analysis.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryAuditLogger {

    public static final String UNKNOWN_USER = "UNKNOWN";

    private final QueryAuditRepository auditRepository;
    private final Clock clock;

    public void record(String userIdent, AnalysisType analysisType, QueryMode mode, UUID websiteId, String queryText) {
        String ident = userIdent == null || userIdent.isBlank() ? UNKNOWN_USER : userIdent;
        Instant now = clock.instant();
        try {
            auditRepository.save(QueryAuditEntity.builder()
                    .userIdent(ident)
                    .userLabel(toLabel(ident))
                    .analysisType(analysisType)
                    .jobMode(mode)
                    .websiteId(websiteId)
                    .queryText(annotate(queryText, ident, analysisType, mode, now))
                    .createdAt(now)
                    .build());

            log.debug("Audited {} {} for {}", mode, analysisType.getLabel(), ident);

        } catch (RuntimeException e) {
            log.error("Failed to write query audit for {} ({}): {}", ident, analysisType.getLabel(), e.getMessage(), e);
        }
    }

    /**
     * Label-safe form: lowercase, anything outside {@code [a-z0-9_-]} becomes {@code _}.
     */
    public static String toLabel(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }

    static String annotate(String queryText, String ident, AnalysisType analysisType, QueryMode mode, Instant now) {
        StringBuilder header = new StringBuilder()
                .append("-- User ident: ").append(ident).append('\n')
                .append("-- Timestamp: ").append(now).append('\n');
        if (mode == QueryMode.DRY_RUN) {
            header.append("-- Mode: Dry Run\n");
        }
        header.append("-- Analysis: ").append(analysisType.getLabel()).append('\n');
        return header + (queryText == null ? "" : queryText);
    }
}
