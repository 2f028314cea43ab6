package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.AnalysisProperties;
import com.funnelanalytics.domain.exception.AnalysisException;
import com.funnelanalytics.domain.exception.InvalidStepPatternException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.QueryStats;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.model.TimingResponse;
import com.funnelanalytics.domain.model.TimingResult;
import com.funnelanalytics.domain.pattern.StepPattern;
import com.funnelanalytics.domain.query.HitStreamSqlRenderer;
import com.funnelanalytics.domain.query.RenderedQuery;
import com.funnelanalytics.domain.timing.SessionTimingMatcher;
import com.funnelanalytics.domain.timing.TimingAggregator;
import com.funnelanalytics.domain.timing.TimingQuery;
import com.funnelanalytics.domain.timing.TransitionRecord;
import com.funnelanalytics.infrastructure.audit.QueryAuditLogger;
import com.funnelanalytics.infrastructure.cache.QueryCacheService;
import com.funnelanalytics.infrastructure.persistence.entity.QueryAuditEntity.QueryMode;
import com.funnelanalytics.infrastructure.warehouse.HitStreamProvider;
import com.funnelanalytics.infrastructure.warehouse.HitStreamRequest;
import com.funnelanalytics.infrastructure.warehouse.QueryCostEstimator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Time between funnel steps, for URL-only funnels.
 *
 * Sessions are independent, so matching fans out over the matching executor in chunks
 * and the per-chunk transition records are concatenated before aggregation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelTimingService {

    private final HitStreamProvider hitStreamProvider;
    private final SessionTimingMatcher matcher;
    private final TimingAggregator aggregator;
    private final HitStreamSqlRenderer sqlRenderer;
    private final QueryCostEstimator costEstimator;
    private final QueryAuditLogger auditLogger;
    private final QueryCacheService cacheService;
    private final AnalysisProperties analysisProperties;
    private final MeterRegistry meterRegistry;

    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    @Qualifier("matchingExecutor")
    private final Executor matchingExecutor;

    @Value("${app.cache.ttl.analysis:3600}")
    private long analysisTtl;

    public TimingQuery prepare(FunnelRequest request) {
        StepPattern pattern = StepPattern.of(request.resolveSteps());
        if (!pattern.isUrlOnly()) {
            throw new InvalidStepPatternException("Funnel timing only supports URL steps");
        }
        AnalysisWindow window = AnalysisWindow.parse(request.getWebsiteId(), request.getStartDate(), request.getEndDate());
        return new TimingQuery(window, pattern.values(), request.entryMode());
    }

    public TimingResponse timeFunnel(FunnelRequest request, String userIdent) {
        return execute(prepare(request), userIdent);
    }

    public CompletableFuture<TimingResponse> timeFunnelAsync(FunnelRequest request, String userIdent) {
        TimingQuery query = prepare(request);
        return CompletableFuture.supplyAsync(() -> execute(query, userIdent), analysisExecutor);
    }

    TimingResponse execute(TimingQuery query, String userIdent) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AnalysisWindow window = query.getWindow();

        try {
            String cacheKey = cacheService.generateCacheKey(
                    "analysis:funnel-timing",
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    query.getMode(),
                    query.getStepValues()
            );

            Optional<TimingResponse> cached = cacheService.get(cacheKey, TimingResponse.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for funnel timing: {}", cacheKey);
                countCache("hit");
                TimingResponse response = cached.get();
                response.setCached(true);
                return response;
            }
            countCache("miss");

            HitStreamRequest hitRequest = HitStreamRequest.pageviews(window);
            RenderedQuery rendered = sqlRenderer.render(hitRequest);

            QueryStats queryStats = costEstimator.estimate(hitRequest, AnalysisType.FUNNEL_TIMING, userIdent, rendered.getSql());
            auditLogger.record(userIdent, AnalysisType.FUNNEL_TIMING, QueryMode.EXECUTION, window.getWebsiteId(), rendered.getSql());

            long startTime = System.currentTimeMillis();
            List<SessionHits> sessions = hitStreamProvider.fetchSessions(hitRequest);
            List<TimingResult> data = sessions.isEmpty()
                    ? List.of()
                    : aggregator.aggregate(matchAll(sessions, query));
            long queryTime = System.currentTimeMillis() - startTime;

            TimingResponse response = TimingResponse.builder()
                    .data(data)
                    .queryStats(queryStats)
                    .sql(rendered.substituted())
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, analysisTtl);

            sample.stop(Timer.builder("analysis.latency")
                    .tag("type", AnalysisType.FUNNEL_TIMING.getLabel())
                    .register(meterRegistry));
            countExecuted("success");

            log.info("Funnel timing executed: {} steps, {} sessions, {} ms",
                    query.getStepValues().size(), sessions.size(), queryTime);
            return response;

        } catch (AnalysisException e) {
            countExecuted("error");
            log.error("Funnel timing failed: {}", e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            countExecuted("error");
            log.error("Error executing funnel timing: {}", e.getMessage(), e);
            throw new QueryExecutionException("Funnel timing query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fan-out/fan-in over session chunks. Records are merged by concatenation.
     */
    List<TransitionRecord> matchAll(List<SessionHits> sessions, TimingQuery query) {
        int chunkSize = analysisProperties.getTimingChunkSize();
        List<CompletableFuture<List<TransitionRecord>>> chunks = new ArrayList<>();

        for (int from = 0; from < sessions.size(); from += chunkSize) {
            List<SessionHits> chunk = sessions.subList(from, Math.min(from + chunkSize, sessions.size()));
            chunks.add(CompletableFuture.supplyAsync(() -> matchChunk(chunk, query), matchingExecutor));
        }

        try {
            return chunks.stream()
                    .map(CompletableFuture::join)
                    .flatMap(List::stream)
                    .collect(Collectors.toList());
        } catch (CompletionException e) {
            chunks.forEach(future -> future.cancel(true));
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new QueryExecutionException("Session matching failed: " + cause.getMessage(), cause);
        }
    }

    private List<TransitionRecord> matchChunk(List<SessionHits> chunk, TimingQuery query) {
        List<TransitionRecord> records = new ArrayList<>();
        for (SessionHits session : chunk) {
            records.addAll(matcher.match(session.hitsOfKind(HitKind.PAGEVIEW), query.getStepValues(), query.getMode())
                    .transitions());
        }
        return records;
    }

    private void countCache(String result) {
        Counter.builder("analysis.cache")
                .tag("type", AnalysisType.FUNNEL_TIMING.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void countExecuted(String result) {
        Counter.builder("analysis.executed")
                .tag("type", AnalysisType.FUNNEL_TIMING.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
