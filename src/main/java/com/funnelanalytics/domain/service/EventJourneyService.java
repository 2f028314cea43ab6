package com.funnelanalytics.domain.service;

import com.funnelanalytics.domain.exception.AnalysisException;
import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import com.funnelanalytics.domain.exception.QueryExecutionException;
import com.funnelanalytics.domain.journey.EventJourney;
import com.funnelanalytics.domain.journey.EventJourneyCompiler;
import com.funnelanalytics.domain.journey.EventJourneyQuery;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.EventJourneyRequest;
import com.funnelanalytics.domain.model.EventJourneyResponse;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.QueryStats;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.pattern.UrlPathNormalizer;
import com.funnelanalytics.domain.pattern.ValuePattern;
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

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Most frequent sequences of custom events on a page, with how sessions without events left it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventJourneyService {

    private static final int DEFAULT_MIN_EVENTS = 1;

    private final HitStreamProvider hitStreamProvider;
    private final EventJourneyCompiler journeyCompiler;
    private final HitStreamSqlRenderer sqlRenderer;
    private final QueryCostEstimator costEstimator;
    private final QueryAuditLogger auditLogger;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Qualifier("analysisExecutor")
    private final Executor analysisExecutor;

    @Value("${app.cache.ttl.analysis:3600}")
    private long analysisTtl;

    public EventJourneyQuery prepare(EventJourneyRequest request) {
        int minEvents = request.getMinEvents() == null ? DEFAULT_MIN_EVENTS : request.getMinEvents();
        if (minEvents < 1) {
            throw new InvalidAnalysisRequestException("minEvents must be at least 1, got " + minEvents);
        }

        ValuePattern page = request.getUrlPath() == null || request.getUrlPath().isBlank()
                ? null
                : ValuePattern.of(UrlPathNormalizer.normalize(request.getUrlPath().trim()));

        Set<String> eventFilter = new LinkedHashSet<>();
        if (request.getEventFilter() != null) {
            request.getEventFilter().stream()
                    .filter(name -> name != null && !name.isBlank())
                    .map(String::trim)
                    .forEach(eventFilter::add);
        }

        AnalysisWindow window = AnalysisWindow.parse(request.getWebsiteId(), request.getStartDate(), request.getEndDate());
        return new EventJourneyQuery(window, page, minEvents, Set.copyOf(eventFilter));
    }

    public EventJourneyResponse buildEventJourneys(EventJourneyRequest request, String userIdent) {
        return execute(prepare(request), userIdent);
    }

    public CompletableFuture<EventJourneyResponse> buildEventJourneysAsync(EventJourneyRequest request, String userIdent) {
        EventJourneyQuery query = prepare(request);
        return CompletableFuture.supplyAsync(() -> execute(query, userIdent), analysisExecutor);
    }

    EventJourneyResponse execute(EventJourneyQuery query, String userIdent) {
        Timer.Sample sample = Timer.start(meterRegistry);
        AnalysisWindow window = query.getWindow();

        try {
            String cacheKey = cacheService.generateCacheKey(
                    "analysis:event-journey",
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    query.getPage(),
                    query.getMinEvents(),
                    new TreeSet<>(query.getEventFilter())
            );

            Optional<EventJourneyResponse> cached = cacheService.get(cacheKey, EventJourneyResponse.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for event journeys: {}", cacheKey);
                countCache("hit");
                EventJourneyResponse response = cached.get();
                response.setCached(true);
                return response;
            }
            countCache("miss");

            HitStreamRequest hitRequest = HitStreamRequest.of(window, EnumSet.of(HitKind.PAGEVIEW, HitKind.EVENT), true);
            RenderedQuery rendered = sqlRenderer.render(hitRequest);

            auditLogger.record(userIdent, AnalysisType.EVENT_JOURNEY, QueryMode.EXECUTION, window.getWebsiteId(), rendered.getSql());

            long startTime = System.currentTimeMillis();
            List<SessionHits> sessions = hitStreamProvider.fetchSessions(hitRequest);
            EventJourney journeys = sessions.isEmpty()
                    ? EventJourney.empty()
                    : journeyCompiler.compile(sessions, query);
            long queryTime = System.currentTimeMillis() - startTime;

            QueryStats queryStats = costEstimator.estimate(hitRequest, AnalysisType.EVENT_JOURNEY, userIdent, rendered.getSql());

            EventJourneyResponse response = EventJourneyResponse.builder()
                    .journeys(journeys.getPaths())
                    .journeyStats(journeys.getStats())
                    .queryStats(queryStats)
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, analysisTtl);

            sample.stop(Timer.builder("analysis.latency")
                    .tag("type", AnalysisType.EVENT_JOURNEY.getLabel())
                    .register(meterRegistry));
            countExecuted("success");

            log.info("Event journeys executed on {}: {} paths, {} sessions on page, {} sessions read, {} ms",
                    query.getPage() == null ? "whole site" : query.getPage(), journeys.getPaths().size(),
                    journeys.getStats().getTotalSessions(), sessions.size(), queryTime);
            return response;

        } catch (AnalysisException e) {
            countExecuted("error");
            log.error("Event journey analysis failed: {}", e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            countExecuted("error");
            log.error("Error executing event journey analysis: {}", e.getMessage(), e);
            throw new QueryExecutionException("Event journey query failed: " + e.getMessage(), e);
        }
    }

    private void countCache(String result) {
        Counter.builder("analysis.cache")
                .tag("type", AnalysisType.EVENT_JOURNEY.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private void countExecuted(String result) {
        Counter.builder("analysis.executed")
                .tag("type", AnalysisType.EVENT_JOURNEY.getLabel())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
