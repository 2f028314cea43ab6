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
 * Analysis submitted for background processing.
 *
 * Wide windows on busy sites can run for minutes; callers submit them here
 * and poll for the serialized response.
 */
@Entity
@Table(name = "async_jobs", indexes = {
    @Index(name = "idx_status_created", columnList = "status,createdAt"),
    @Index(name = "idx_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AsyncJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private AnalysisType analysisType;

    @Column(nullable = false, length = 100)
    private String userIdent;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String requestJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String resultJson;

    @Column(length = 1000)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        this.status = JobStatus.RUNNING;
        this.startedAt = Instant.now();
    }

    public void markCompleted(String resultJson) {
        this.status = JobStatus.COMPLETED;
        this.resultJson = resultJson;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = JobStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.completedAt = Instant.now();
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
