package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.exception.AnalysisException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.funnel.FunnelPlanCompiler;
import com.funnelanalytics.domain.funnel.FunnelPlanEvaluator;
import com.funnelanalytics.domain.funnel.FunnelQueryPlan;
import com.funnelanalytics.domain.funnel.FunnelSqlRenderer;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.FunnelRequest;
import com.funnelanalytics.domain.model.FunnelResponse;
import com.funnelanalytics.domain.model.FunnelStepResult;
import com.funnelanalytics.domain.model.QueryStats;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.pattern.StepPattern;
import com.funnelanalytics.domain.query.RenderedQuery;
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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Funnel step counts.
 *
 * Query Flow:
 * 1. Validate steps and window (before anything touches the warehouse)
 * 2. Compile the step pattern into a stage plan and render it for transparency
 * 3. Check cache (Redis)
 * 4. Dry run for cost, audit, read hits
 * 5. Evaluate the plan per session, cache and return
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FunnelAnalysisService {

    private final HitStreamProvider hitStreamProvider;
    private final FunnelPlanCompiler planCompiler;
    private final FunnelPlanEvaluator planEvaluator;
    private final FunnelSqlRenderer sqlRenderer;
    private final QueryCostEstimator costEstimator;
    private final QueryAuditLogger auditLogger;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    @Value("${app.cache.ttl.analysis:3600}")
    private long analysisTtl;

    /**
     * Validates and compiles the request. Throws on bad input.
     */
    public FunnelQueryPlan prepare(FunnelRequest request) {
        StepPattern pattern = StepPattern.of(request.resolveSteps());
        AnalysisWindow window = AnalysisWindow.parse(request.getWebsiteId(), request.getStartDate(), request.getEndDate());
        return planCompiler.compile(pattern, request.entryMode(), window);
    }

    public FunnelResponse countFunnel(FunnelRequest request, String userIdent) {
        return execute(prepare(request), userIdent);
    }

    /**
     * Validation happens on the caller's thread; only the warehouse work is dispatched.
     */
    public CompletableFuture<FunnelResponse> countFunnelAsync(FunnelRequest request, String userIdent) {
        FunnelQueryPlan plan = prepare(request);
        return CompletableFuture.supplyAsync(() -> execute(plan, userIdent), analysisExecutor);
    }

    FunnelResponse execute(FunnelQueryPlan plan, String userIdent) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AnalysisWindow window = plan.getWindow();

        try {
            String cacheKey = cacheService.generateCacheKey(
                    "analysis:funnel",
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    plan.getMode(),
                    plan.getPattern().steps()
            );

            Optional<FunnelResponse> cached = cacheService.get(cacheKey, FunnelResponse.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for funnel: {}", cacheKey);
                countCache("hit");
                FunnelResponse response = cached.get();
                response.setCached(true);
                return response;
            }
            countCache("miss");

            RenderedQuery rendered = sqlRenderer.render(plan);
            HitStreamRequest hitRequest = plan.hitStreamRequest();

            QueryStats queryStats = costEstimator.estimate(hitRequest, AnalysisType.FUNNEL, userIdent, rendered.getSql());
            auditLogger.record(userIdent, AnalysisType.FUNNEL, QueryMode.EXECUTION, window.getWebsiteId(), rendered.getSql());

            long startTime = System.currentTimeMillis();
            List<SessionHits> sessions = hitStreamProvider.fetchSessions(hitRequest);
            List<FunnelStepResult> data = sessions.isEmpty()
                    ? List.of()
                    : planEvaluator.evaluate(plan, sessions);
            long queryTime = System.currentTimeMillis() - startTime;

            FunnelResponse response = FunnelResponse.builder()
                    .data(data)
                    .queryStats(queryStats)
                    .sql(rendered.substituted())
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, analysisTtl);

            sample.stop(Timer.builder("analysis.latency")
                    .tag("type", AnalysisType.FUNNEL.getLabel())
                    .register(meterRegistry));
            countExecuted("success");

            log.info("Funnel executed: {} steps, {} sessions, {} ms", plan.stageCount(), sessions.size(), queryTime);
            return response;

        } catch (AnalysisException e) {
            countExecuted("error");
            log.error("Funnel analysis failed: {}", e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            countExecuted("error");
            log.error("Error executing funnel analysis: {}", e.getMessage(), e);
            throw new QueryExecutionException("Funnel query failed: " + e.getMessage(), e);
        }
    }

    private void countCache(String result) {
        Counter.builder("analysis.cache")
                .tag("type", AnalysisType.FUNNEL.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void countExecuted(String result) {
        Counter.builder("analysis.executed")
                .tag("type", AnalysisType.FUNNEL.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
