package com.funnelanalytics.infrastructure.persistence.entity;

import com.funnelanalytics.domain.model.AnalysisType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Who ran which warehouse query, for compliance review.
 */
@Entity
@Table(name = "query_audit", indexes = {
    @Index(name = "idx_audit_user", columnList = "userLabel,createdAt"),
    @Index(name = "idx_audit_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryAuditEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID auditId;

    @Column(nullable = false, length = 100)
    private String userIdent;

    /** Sanitized form of userIdent: lowercase, [a-z0-9_-] only. */
    @Column(nullable = false, length = 100)
    private String userLabel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AnalysisType analysisType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private QueryMode jobMode;

    @Column(columnDefinition = "UUID")
    private UUID websiteId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String queryText;

    @Column(nullable = false)
    private Instant createdAt;

    public enum QueryMode {
        DRY_RUN,
        EXECUTION
    }

    @PrePersist
    protected void onCreate() {
        if (auditId == null) {
            auditId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
