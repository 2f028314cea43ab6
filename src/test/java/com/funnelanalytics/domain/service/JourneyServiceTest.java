package com.funnelanalytics.domain.service;

import com.funnelanalytics.config.AnalysisProperties;
import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import com.funnelanalytics.domain.exception.WarehouseUnavailableException;
import com.funnelanalytics.domain.journey.JourneyGraphCompiler;
import com.funnelanalytics.domain.journey.JourneyQuery;
import com.funnelanalytics.domain.model.AnalysisType;
import com.funnelanalytics.domain.model.JourneyDirection;
import com.funnelanalytics.domain.model.JourneyRequest;
import com.funnelanalytics.domain.model.JourneyResponse;
import com.funnelanalytics.domain.query.HitStreamSqlRenderer;
import com.funnelanalytics.infrastructure.audit.QueryAuditLogger;
import com.funnelanalytics.infrastructure.cache.QueryCacheService;
import com.funnelanalytics.infrastructure.warehouse.HitStreamProvider;
import com.funnelanalytics.infrastructure.warehouse.QueryCostEstimator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.funnelanalytics.domain.HitFixtures.pages;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JourneyServiceTest {

    private static final UUID WEBSITE = UUID.randomUUID();

    @Mock
    private HitStreamProvider hitStreamProvider;

    @Mock
    private QueryCostEstimator costEstimator;

    @Mock
    private QueryAuditLogger auditLogger;

    @Mock
    private QueryCacheService cacheService;

    private JourneyService service;

    @BeforeEach
    void setUp() {
        service = new JourneyService(
                hitStreamProvider,
                new JourneyGraphCompiler(),
                new HitStreamSqlRenderer(new WarehouseProperties()),
                costEstimator,
                auditLogger,
                cacheService,
                new AnalysisProperties(),
                new SimpleMeterRegistry(),
                Runnable::run);
    }

    @Test
    void testBuildJourney_Forward() {
        // Given
        when(hitStreamProvider.fetchSessions(any())).thenReturn(List.of(
                pages("s1", "/a", "/b"),
                pages("s2", "/a", "/b", "/c")));

        // When
        JourneyResponse response = service.buildJourney(request("/a/", "forward", 2, 5), "alice");

        // Then
        assertEquals(3, response.getNodes().size());
        assertEquals(2, response.getLinks().size());
        assertEquals(2, response.getLinks().get(0).getValue());
        assertFalse(response.isCached());
        verify(costEstimator).estimate(any(), eq(AnalysisType.JOURNEY), eq("alice"), anyString());
    }

    @Test
    void testBuildJourney_NoRows() {
        when(hitStreamProvider.fetchSessions(any())).thenReturn(List.of());

        JourneyResponse response = service.buildJourney(request("/a", "backward", 3, 30), "alice");

        assertTrue(response.getNodes().isEmpty());
        assertTrue(response.getLinks().isEmpty());
    }

    @Test
    void testBuildJourney_CacheHit() {
        when(cacheService.get(any(), eq(JourneyResponse.class)))
                .thenReturn(Optional.of(JourneyResponse.builder().nodes(List.of()).links(List.of()).build()));

        JourneyResponse response = service.buildJourney(request("/a", "forward", 3, 30), "alice");

        assertTrue(response.isCached());
        verifyNoInteractions(hitStreamProvider);
    }

    @Test
    void testPrepare_Defaults() {
        JourneyRequest request = JourneyRequest.builder()
                .websiteId(WEBSITE)
                .startUrl("/pricing?utm=x")
                .startDate("2024-03-01")
                .endDate("2024-03-07")
                .steps(null)
                .limit(null)
                .direction(null)
                .build();

        JourneyQuery query = service.prepare(request);

        assertEquals("/pricing", query.getStartUrl());
        assertEquals(JourneyDirection.FORWARD, query.getDirection());
        assertEquals(3, query.getHorizon());
        assertEquals(30, query.getEdgeCap());
    }

    @Test
    void testPrepare_RejectsOutOfRangeSteps() {
        assertThrows(InvalidAnalysisRequestException.class, () -> service.prepare(request("/a", "forward", 0, 5)));
        assertThrows(InvalidAnalysisRequestException.class, () -> service.prepare(request("/a", "forward", 16, 5)));
        assertThrows(InvalidAnalysisRequestException.class, () -> service.prepare(request("/a", "forward", 3, 0)));
    }

    @Test
    void testPrepare_RejectsUnknownDirection() {
        assertThrows(InvalidAnalysisRequestException.class, () -> service.buildJourneyAsync(request("/a", "sideways", 3, 5), "alice"));
        verifyNoInteractions(hitStreamProvider);
    }

    @Test
    void testPrepare_RejectsBlankStart() {
        assertThrows(InvalidAnalysisRequestException.class, () -> service.prepare(request(" ", "forward", 3, 5)));
    }

    @Test
    void testBuildJourney_WarehouseDown() {
        when(hitStreamProvider.fetchSessions(any()))
                .thenThrow(new WarehouseUnavailableException("down", new RuntimeException()));

        assertThrows(WarehouseUnavailableException.class,
                () -> service.buildJourney(request("/a", "forward", 3, 5), "alice"));
    }

    private static JourneyRequest request(String startUrl, String direction, int steps, int limit) {
        return JourneyRequest.builder()
                .websiteId(WEBSITE)
                .startUrl(startUrl)
                .startDate("2024-03-01")
                .endDate("2024-03-07")
                .direction(direction)
                .steps(steps)
                .limit(limit)
                .build();
    }
}
