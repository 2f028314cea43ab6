package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.exception.QueryResourceLimitException;
import com.funnelanalytics.domain.exception.WarehouseUnavailableException;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.infrastructure.persistence.entity.EventDataEntity;
import com.funnelanalytics.infrastructure.persistence.entity.WebsiteEventEntity;
import com.funnelanalytics.infrastructure.persistence.repository.EventDataRepository;
import com.funnelanalytics.infrastructure.persistence.repository.WebsiteEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JpaHitStreamProviderTest {

    private static final UUID WEBSITE = UUID.randomUUID();
    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-02T00:00:00Z");
    private static final AnalysisWindow WINDOW = AnalysisWindow.of(WEBSITE, START, END);

    @Mock
    private WebsiteEventRepository eventRepository;

    @Mock
    private EventDataRepository eventDataRepository;

    private WarehouseProperties properties;
    private JpaHitStreamProvider provider;

    @BeforeEach
    void setUp() {
        properties = new WarehouseProperties();
        properties.setMaxRowsScanned(1_000);
        provider = new JpaHitStreamProvider(eventRepository, eventDataRepository, properties);
    }

    @Test
    void testFetchSessions_GroupsAndNormalizes() {
        // Given
        UUID s1 = UUID.randomUUID();
        UUID s2 = UUID.randomUUID();
        when(eventRepository.countHits(WEBSITE, START, END, List.of(1))).thenReturn(3L);
        when(eventRepository.findHits(WEBSITE, START, END, List.of(1))).thenReturn(List.of(
                pageview(s1, "/a/?x=1", 0),
                pageview(s2, "//b", 5),
                pageview(s1, "/c#top", 10)));

        // When
        List<SessionHits> sessions = provider.fetchSessions(HitStreamRequest.pageviews(WINDOW));

        // Then
        assertEquals(2, sessions.size());
        assertEquals(s1.toString(), sessions.get(0).getSessionId());
        assertEquals("/a", sessions.get(0).getHits().get(0).getPathOrName());
        assertEquals("/c", sessions.get(0).getHits().get(1).getPathOrName());
        assertEquals("/b", sessions.get(1).getHits().get(0).getPathOrName());
        verifyNoInteractions(eventDataRepository);
    }

    @Test
    void testFetchSessions_AttachesEventParameters() {
        UUID session = UUID.randomUUID();
        WebsiteEventEntity purchase = event(session, "/pricing/", "purchase", 10);
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(1L);
        when(eventRepository.findHits(WEBSITE, START, END, List.of(1, 2))).thenReturn(List.of(purchase));
        when(eventDataRepository.findInWindow(WEBSITE, START, END)).thenReturn(List.of(
                EventDataEntity.builder().websiteEventId(purchase.getEventId()).dataKey("plan").stringValue("pro").build()));

        List<SessionHits> sessions = provider.fetchSessions(
                HitStreamRequest.of(WINDOW, EnumSet.of(HitKind.PAGEVIEW, HitKind.EVENT), true));

        NormalizedHit hit = sessions.get(0).getHits().get(0);
        assertEquals(HitKind.EVENT, hit.getKind());
        assertEquals("purchase", hit.getPathOrName());
        assertEquals("/pricing", hit.getPageContext());
        assertEquals(List.of("pro"), hit.parameterValues("plan"));
    }

    @Test
    void testFetchSessions_OverScanLimit() {
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(5_000L);

        QueryResourceLimitException e = assertThrows(QueryResourceLimitException.class,
                () -> provider.fetchSessions(HitStreamRequest.pageviews(WINDOW)));

        assertEquals(5_000L, e.getRowsRequested());
        verify(eventRepository, never()).findHits(any(), any(), any(), any());
    }

    @Test
    void testFetchSessions_ParameterRowsCountTowardScanLimit() {
        // Given
        properties.setMaxRowsScanned(10);
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(2L);
        when(eventDataRepository.countInWindow(WEBSITE, START, END)).thenReturn(5_000L);

        // When
        QueryResourceLimitException e = assertThrows(QueryResourceLimitException.class,
                () -> provider.fetchSessions(HitStreamRequest.of(WINDOW, EnumSet.of(HitKind.EVENT), true)));

        // Then
        assertEquals(5_002L, e.getRowsRequested());
        verify(eventRepository, never()).findHits(any(), any(), any(), any());
        verify(eventDataRepository, never()).findInWindow(any(), any(), any());
    }

    @Test
    void testFetchSessions_ReadsOnlyFilteredParameterKeys() {
        UUID session = UUID.randomUUID();
        WebsiteEventEntity purchase = event(session, "/pricing", "purchase", 10);
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(1L);
        when(eventDataRepository.countInWindowForKeys(WEBSITE, START, END, List.of("coupon", "plan"))).thenReturn(2L);
        when(eventRepository.findHits(WEBSITE, START, END, List.of(2))).thenReturn(List.of(purchase));
        when(eventDataRepository.findInWindowForKeys(WEBSITE, START, END, List.of("coupon", "plan"))).thenReturn(List.of(
                EventDataEntity.builder().websiteEventId(purchase.getEventId()).dataKey("plan").stringValue("pro").build()));

        List<SessionHits> sessions = provider.fetchSessions(HitStreamRequest.withParameterKeys(
                WINDOW, EnumSet.of(HitKind.EVENT), Set.of("plan", "coupon")));

        assertEquals(List.of("pro"), sessions.get(0).getHits().get(0).parameterValues("plan"));
        verify(eventDataRepository, never()).findInWindow(any(), any(), any());
        verify(eventDataRepository, never()).countInWindow(any(), any(), any());
    }

    @Test
    void testCountHits_AddsParameterRowsOnlyWhenAttached() {
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(40L);
        when(eventDataRepository.countInWindow(WEBSITE, START, END)).thenReturn(60L);

        assertEquals(40L, provider.countHits(HitStreamRequest.pageviews(WINDOW)));
        assertEquals(100L, provider.countHits(HitStreamRequest.of(WINDOW, EnumSet.of(HitKind.EVENT), true)));
    }

    @Test
    void testFetchSessions_EqualTimestampsKeepReadOrder() {
        UUID session = UUID.randomUUID();
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(2L);
        when(eventRepository.findHits(WEBSITE, START, END, List.of(1))).thenReturn(List.of(
                pageview(session, "/first", 30),
                pageview(session, "/second", 30)));

        List<NormalizedHit> hits = provider.fetchSessions(HitStreamRequest.pageviews(WINDOW)).get(0).getHits();

        assertEquals("/first", hits.get(0).getPathOrName());
        assertEquals("/second", hits.get(1).getPathOrName());
        assertTrue(hits.get(0).getSequence() < hits.get(1).getSequence());
    }

    @Test
    void testFetchSessions_NoRows() {
        when(eventRepository.countHits(any(), any(), any(), any())).thenReturn(0L);

        assertTrue(provider.fetchSessions(HitStreamRequest.pageviews(WINDOW)).isEmpty());
        verify(eventRepository, never()).findHits(any(), any(), any(), any());
    }

    @Test
    void testFetchSessions_ConnectionFailure() {
        when(eventRepository.countHits(any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(WarehouseUnavailableException.class,
                () -> provider.fetchSessions(HitStreamRequest.pageviews(WINDOW)));
    }

    @Test
    void testToHit_PageviewUsesPathForBoth() {
        NormalizedHit hit = JpaHitStreamProvider.toHit(pageview(UUID.randomUUID(), "", 0), 7, Map.of());

        assertEquals("/", hit.getPathOrName());
        assertEquals("/", hit.getPageContext());
        assertEquals(7, hit.getSequence());
    }

    private static WebsiteEventEntity pageview(UUID session, String path, long seconds) {
        return WebsiteEventEntity.builder()
                .eventId(UUID.randomUUID())
                .websiteId(WEBSITE)
                .sessionId(session)
                .eventType(HitKind.PAGEVIEW.getCode())
                .urlPath(path)
                .createdAt(START.plusSeconds(seconds))
                .build();
    }

    private static WebsiteEventEntity event(UUID session, String path, String name, long seconds) {
        return WebsiteEventEntity.builder()
                .eventId(UUID.randomUUID())
                .websiteId(WEBSITE)
                .sessionId(session)
                .eventType(HitKind.EVENT.getCode())
                .urlPath(path)
                .eventName(name)
                .createdAt(START.plusSeconds(seconds))
                .build();
    }
}
