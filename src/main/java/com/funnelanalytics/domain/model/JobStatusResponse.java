package com.funnelanalytics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private UUID jobId;
    private AnalysisType queryType;
    private AsyncJobEntity.JobStatus status;

    /** Serialized analysis response, embedded as-is. */
    @JsonRawValue
    private String result;

    private String errorMessage;
    private Instant createdAt;
    private Instant completedAt;
    private long executionTimeMs;

    public static JobStatusResponse from(AsyncJobEntity job) {
        return JobStatusResponse.builder()
                .jobId(job.getJobId())
                .queryType(job.getAnalysisType())
                .status(job.getStatus())
                .result(job.getResultJson())
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .executionTimeMs(job.getExecutionTimeMs())
                .build();
    }
}
