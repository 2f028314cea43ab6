package com.funnelanalytics.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import com.funnelanalytics.domain.exception.JobNotFoundException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.EventJourneyRequest;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.JobStatusResponse;
import com.funnelanalytics.domain.model.JourneyRequest;
import com.funnelanalytics.infrastructure.persistence.entity.AsyncJobEntity;
import com.funnelanalytics.infrastructure.persistence.repository.AsyncJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Background processing for wide analyses.
 *
 * Processing Flow:
 * 1. Request is validated and stored with PENDING status, job id returned
 * 2. Scheduler picks up PENDING jobs every second and marks them RUNNING
 * 3. Job runs on the analysis executor through the same service path as the sync endpoints
 * 4. Serialized response stored, job COMPLETED
 *
 * Failure Handling:
 * - Invalid requests are rejected at submission, never stored
 * - Execution errors mark the job FAILED with the error message
 * - A full executor queue leaves the job PENDING for the next poll
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncJobProcessor {

    private final AsyncJobRepository asyncJobRepository;
    private final FunnelAnalysisService funnelAnalysisService;
    private final FunnelTimingService funnelTimingService;
    private final JourneyService journeyService;
    private final EventJourneyService eventJourneyService;
    private final ObjectMapper objectMapper;

    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    /**
     * Validates and stores the job. Returns the job id immediately.
     */
    @Transactional
    public UUID submitAsyncJob(AnalysisType type, JsonNode request, String userIdent) {
        validate(type, request);

        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new InvalidAnalysisRequestException("Request is not serializable: " + e.getOriginalMessage());
        }

        AsyncJobEntity job = AsyncJobEntity.builder()
                .analysisType(type)
                .userIdent(userIdent)
                .requestJson(requestJson)
                .build();

        job = asyncJobRepository.save(job);
        log.info("Async job submitted: {} (type: {}, user: {})", job.getJobId(), type, userIdent);
        return job.getJobId();
    }

    @Transactional(readOnly = true)
    public JobStatusResponse getJobStatus(UUID jobId) {
        return asyncJobRepository.findById(jobId)
                .map(JobStatusResponse::from)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Each job is persisted as RUNNING before it is handed to the executor.
     */
    @Scheduled(fixedDelayString = "${async.jobs.poll-interval-ms:1000}")
    public void processPendingJobs() {
        List<AsyncJobEntity> pendingJobs = asyncJobRepository
                .findTop10ByStatusOrderByCreatedAtAsc(AsyncJobEntity.JobStatus.PENDING);

        if (pendingJobs.isEmpty()) {
            return;
        }

        log.debug("Processing {} pending async jobs", pendingJobs.size());

        for (AsyncJobEntity job : pendingJobs) {
            job.markStarted();
            AsyncJobEntity running = asyncJobRepository.save(job);
            try {
                analysisExecutor.execute(() -> runJob(running));
            } catch (TaskRejectedException e) {
                log.warn("Analysis executor saturated, job {} stays pending", job.getJobId());
                running.setStatus(AsyncJobEntity.JobStatus.PENDING);
                running.setStartedAt(null);
                asyncJobRepository.save(running);
                return;
            }
        }
    }

    void runJob(AsyncJobEntity job) {
        try {
            log.info("Processing async job: {} (type: {})", job.getJobId(), job.getAnalysisType());

            Object result = execute(job);

            job.markCompleted(objectMapper.writeValueAsString(result));
            asyncJobRepository.save(job);

            log.info("Async job completed: {} ({} ms)", job.getJobId(), job.getExecutionTimeMs());

        } catch (Exception e) {
            log.error("Error processing async job {}: {}", job.getJobId(), e.getMessage(), e);

            job.markFailed(e.getMessage());
            asyncJobRepository.save(job);
        }
    }

    private Object execute(AsyncJobEntity job) throws JsonProcessingException {
        String user = job.getUserIdent();
        switch (job.getAnalysisType()) {
            case FUNNEL:
                return funnelAnalysisService.countFunnel(
                        objectMapper.readValue(job.getRequestJson(), FunnelRequest.class), user);
            case FUNNEL_TIMING:
                return funnelTimingService.timeFunnel(
                        objectMapper.readValue(job.getRequestJson(), FunnelRequest.class), user);
            case JOURNEY:
                return journeyService.buildJourney(
                        objectMapper.readValue(job.getRequestJson(), JourneyRequest.class), user);
            case EVENT_JOURNEY:
                return eventJourneyService.buildEventJourneys(
                        objectMapper.readValue(job.getRequestJson(), EventJourneyRequest.class), user);
            default:
                throw new QueryExecutionException("Unknown analysis type: " + job.getAnalysisType(), null);
        }
    }

    private void validate(AnalysisType type, JsonNode request) {
        try {
            switch (type) {
                case FUNNEL:
                    funnelAnalysisService.prepare(objectMapper.treeToValue(request, FunnelRequest.class));
                    break;
                case FUNNEL_TIMING:
                    funnelTimingService.prepare(objectMapper.treeToValue(request, FunnelRequest.class));
                    break;
                case JOURNEY:
                    journeyService.prepare(objectMapper.treeToValue(request, JourneyRequest.class));
                    break;
                case EVENT_JOURNEY:
                    eventJourneyService.prepare(objectMapper.treeToValue(request, EventJourneyRequest.class));
                    break;
                default:
                    throw new InvalidAnalysisRequestException("Unknown analysis type: " + type);
            }
        } catch (JsonProcessingException e) {
            throw new InvalidAnalysisRequestException("Malformed " + type.getLabel() + " request: " + e.getOriginalMessage());
        }
    }
}
