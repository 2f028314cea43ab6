package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.AnalysisProperties;
import com.funnelanalytics.domain.exception.AnalysisException;
import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.journey.JourneyGraph;
import com.funnelanalytics.domain.journey.JourneyGraphCompiler;
import com.funnelanalytics.domain.journey.JourneyQuery;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.JourneyDirection;
import com.funnelanalytics.domain.model.JourneyRequest;
import com.funnelanalytics.domain.model.JourneyResponse;
import com.funnelanalytics.domain.model.QueryStats;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.pattern.UrlPathNormalizer;
import com.funnelanalytics.domain.query.HitStreamSqlRenderer;
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
 * Page flow graph around a start page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JourneyService {

    private static final int DEFAULT_STEPS = 3;
    private static final int DEFAULT_LIMIT = 30;

    private final HitStreamProvider hitStreamProvider;
    private final JourneyGraphCompiler graphCompiler;
    private final HitStreamSqlRenderer sqlRenderer;
    private final QueryCostEstimator costEstimator;
    private final QueryAuditLogger auditLogger;
    private final QueryCacheService cacheService;
    private final AnalysisProperties analysisProperties;
    private final MeterRegistry meterRegistry;

    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    @Value("${app.cache.ttl.analysis:3600}")
    private long analysisTtl;

    public JourneyQuery prepare(JourneyRequest request) {
        if (request.getStartUrl() == null || request.getStartUrl().isBlank()) {
            throw new InvalidAnalysisRequestException("startUrl is required");
        }

        int horizon = request.getSteps() == null ? DEFAULT_STEPS : request.getSteps();
        if (horizon < 1 || horizon > analysisProperties.getMaxJourneySteps()) {
            throw new InvalidAnalysisRequestException(
                    "steps must be between 1 and " + analysisProperties.getMaxJourneySteps() + ", got " + horizon);
        }

        int edgeCap = request.getLimit() == null ? DEFAULT_LIMIT : request.getLimit();
        if (edgeCap < 1) {
            throw new InvalidAnalysisRequestException("limit must be at least 1, got " + edgeCap);
        }

        AnalysisWindow window = AnalysisWindow.parse(request.getWebsiteId(), request.getStartDate(), request.getEndDate());
        return new JourneyQuery(
                window,
                UrlPathNormalizer.normalize(request.getStartUrl().trim()),
                JourneyDirection.fromJson(request.getDirection()),
                horizon,
                edgeCap);
    }

    public JourneyResponse buildJourney(JourneyRequest request, String userIdent) {
        return execute(prepare(request), userIdent);
    }

    public CompletableFuture<JourneyResponse> buildJourneyAsync(JourneyRequest request, String userIdent) {
        JourneyQuery query = prepare(request);
        return CompletableFuture.supplyAsync(() -> execute(query, userIdent), analysisExecutor);
    }

    JourneyResponse execute(JourneyQuery query, String userIdent) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AnalysisWindow window = query.getWindow();

        try {
            String cacheKey = cacheService.generateCacheKey(
                    "analysis:journey",
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    query.getStartUrl(),
                    query.getDirection(),
                    query.getHorizon(),
                    query.getEdgeCap()
            );

            Optional<JourneyResponse> cached = cacheService.get(cacheKey, JourneyResponse.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for journey: {}", cacheKey);
                countCache("hit");
                JourneyResponse response = cached.get();
                response.setCached(true);
                return response;
            }
            countCache("miss");

            HitStreamRequest hitRequest = HitStreamRequest.pageviews(window);
            RenderedQuery rendered = sqlRenderer.render(hitRequest);

            auditLogger.record(userIdent, AnalysisType.JOURNEY, QueryMode.EXECUTION, window.getWebsiteId(), rendered.getSql());

            long startTime = System.currentTimeMillis();
            List<SessionHits> sessions = hitStreamProvider.fetchSessions(hitRequest);
            JourneyGraph graph = sessions.isEmpty()
                    ? JourneyGraph.empty()
                    : graphCompiler.compile(sessions, query);
            long queryTime = System.currentTimeMillis() - startTime;

            QueryStats queryStats = costEstimator.estimate(hitRequest, AnalysisType.JOURNEY, userIdent, rendered.getSql());

            JourneyResponse response = JourneyResponse.builder()
                    .nodes(graph.getNodes())
                    .links(graph.getLinks())
                    .queryStats(queryStats)
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, analysisTtl);

            sample.stop(Timer.builder("analysis.latency")
                    .tag("type", AnalysisType.JOURNEY.getLabel())
                    .register(meterRegistry));
            countExecuted("success");

            log.info("Journey executed from {} ({}): {} nodes, {} links, {} sessions, {} ms",
                    query.getStartUrl(), query.getDirection(), graph.getNodes().size(), graph.getLinks().size(),
                    sessions.size(), queryTime);
            return response;

        } catch (AnalysisException e) {
            countExecuted("error");
            log.error("Journey analysis failed: {}", e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            countExecuted("error");
            log.error("Error executing journey analysis: {}", e.getMessage(), e);
            throw new QueryExecutionException("Journey query failed: " + e.getMessage(), e);
        }
    }

    private void countCache(String result) {
        Counter.builder("analysis.cache")
                .tag("type", AnalysisType.JOURNEY.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void countExecuted(String result) {
        Counter.builder("analysis.executed")
                .tag("type", AnalysisType.JOURNEY.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
