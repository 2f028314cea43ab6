package com.funnelanalytics.api;

import com.funnelanalytics.domain.model.EventJourneyRequest;
import com.funnelanalytics.domain.model.EventJourneyResponse;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.FunnelResponse;
import com.funnelanalytics.domain.model.JobStatusResponse;
import com.funnelanalytics.domain.model.JobSubmission;
import com.funnelanalytics.domain.model.JourneyRequest;
import com.funnelanalytics.domain.model.JourneyResponse;
import com.funnelanalytics.domain.model.TimingResponse;
import com.funnelanalytics.domain.service.AsyncJobProcessor;
import com.funnelanalytics.domain.service.EventJourneyService;
import com.funnelanalytics.domain.service.FunnelAnalysisService;
import com.funnelanalytics.domain.service.FunnelTimingService;
import com.funnelanalytics.domain.service.JourneyService;
import com.funnelanalytics.infrastructure.audit.QueryAuditLogger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * REST API for funnel and journey analysis.
 *
 * Endpoints:
 * - POST /api/v1/analytics/funnel - Step counts for a sequential funnel
 * - POST /api/v1/analytics/funnel-timing - Time between URL funnel steps
 * - POST /api/v1/analytics/journeys - Page flow graph around a start page
 * - POST /api/v1/analytics/event-journeys - Most frequent custom event sequences on a page
 * - POST /api/v1/analytics/jobs - Submit async analysis
 * - GET /api/v1/analytics/jobs/{jobId} - Get job status
 *
 * Request validation runs on the servlet thread, so bad input is a 400 before any
 * warehouse work is scheduled.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    static final String USER_HEADER = "X-User-Ident";

    private final FunnelAnalysisService funnelAnalysisService;
    private final FunnelTimingService funnelTimingService;
    private final JourneyService journeyService;
    private final EventJourneyService eventJourneyService;
    private final AsyncJobProcessor asyncJobProcessor;

    /**
     * POST /api/v1/analytics/funnel
     *
     * Response:
     * - data: one row per step with its session count
     * - queryStats: dry-run bytes and cost, absent when the estimate failed
     * - sql: the compiled funnel query with parameters inlined
     */
    @PostMapping("/funnel")
    public CompletableFuture<ResponseEntity<FunnelResponse>> funnel(
            @Valid @RequestBody FunnelRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userIdent) {

        log.info("Funnel: websiteId={}, {} to {}, directEntry={}",
                request.getWebsiteId(), request.getStartDate(), request.getEndDate(), request.getOnlyDirectEntry());

        return funnelAnalysisService.countFunnelAsync(request, resolveUser(userIdent))
                .thenApply(ResponseEntity::ok);
    }

    @PostMapping("/funnel-timing")
    public CompletableFuture<ResponseEntity<TimingResponse>> funnelTiming(
            @Valid @RequestBody FunnelRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userIdent) {

        log.info("Funnel timing: websiteId={}, {} to {}",
                request.getWebsiteId(), request.getStartDate(), request.getEndDate());

        return funnelTimingService.timeFunnelAsync(request, resolveUser(userIdent))
                .thenApply(ResponseEntity::ok);
    }

    @PostMapping("/journeys")
    public CompletableFuture<ResponseEntity<JourneyResponse>> journeys(
            @Valid @RequestBody JourneyRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userIdent) {

        log.info("Journey: websiteId={}, startUrl={}, direction={}, steps={}",
                request.getWebsiteId(), request.getStartUrl(), request.getDirection(), request.getSteps());

        return journeyService.buildJourneyAsync(request, resolveUser(userIdent))
                .thenApply(ResponseEntity::ok);
    }

    /**
     * POST /api/v1/analytics/event-journeys
     *
     * Response:
     * - journeys: up to 100 event paths with their session counts, most frequent first
     * - journeyStats: sessions on the page split into with events, navigated on, bounced
     */
    @PostMapping("/event-journeys")
    public CompletableFuture<ResponseEntity<EventJourneyResponse>> eventJourneys(
            @Valid @RequestBody EventJourneyRequest request,
            @RequestHeader(value = USER_HEADER, required = false) String userIdent) {

        log.info("Event journeys: websiteId={}, urlPath={}, minEvents={}, eventFilter={}",
                request.getWebsiteId(), request.getUrlPath(), request.getMinEvents(), request.getEventFilter());

        return eventJourneyService.buildEventJourneysAsync(request, resolveUser(userIdent))
                .thenApply(ResponseEntity::ok);
    }

    /**
     * POST /api/v1/analytics/jobs
     *
     * Request body:
     * {
     *   "queryType": "FUNNEL|FUNNEL_TIMING|JOURNEY|EVENT_JOURNEY",
     *   "request": { ... }
     * }
     */
    @PostMapping("/jobs")
    public ResponseEntity<Map<String, UUID>> submitAsyncJob(
            @Valid @RequestBody JobSubmission submission,
            @RequestHeader(value = USER_HEADER, required = false) String userIdent) {

        log.info("Submit async job: queryType={}", submission.getQueryType());

        UUID jobId = asyncJobProcessor.submitAsyncJob(
                submission.getQueryType(), submission.getRequest(), resolveUser(userIdent));

        return ResponseEntity.ok(Map.of("jobId", jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable UUID jobId) {
        log.info("Get job status: jobId={}", jobId);
        return ResponseEntity.ok(asyncJobProcessor.getJobStatus(jobId));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static String resolveUser(String userIdent) {
        return userIdent == null || userIdent.isBlank() ? QueryAuditLogger.UNKNOWN_USER : userIdent.trim();
    }
}
