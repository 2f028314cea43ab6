package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.exception.QueryResourceLimitException;
import com.funnelanalytics.domain.exception.WarehouseUnavailableException;
import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.model.SessionHits;
import com.funnelanalytics.domain.pattern.UrlPathNormalizer;
import com.funnelanalytics.infrastructure.persistence.entity.EventDataEntity;
import com.funnelanalytics.infrastructure.persistence.entity.WebsiteEventEntity;
import com.funnelanalytics.infrastructure.persistence.repository.EventDataRepository;
import com.funnelanalytics.infrastructure.persistence.repository.WebsiteEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Hit stream backed by the {@code website_event} / {@code event_data} tables.
 *
 * Read Flow:
 * 1. Count hit rows, plus parameter rows when attached, and refuse when over the scan limit
 * 2. Load hits ordered by session, time and event id
 * 3. Attach event parameters, limited to the requested keys
 * 4. Normalize paths and group into sessions
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaHitStreamProvider implements HitStreamProvider {

    private final WebsiteEventRepository eventRepository;
    private final EventDataRepository eventDataRepository;
    private final WarehouseProperties properties;

    @Override
    public List<SessionHits> fetchSessions(HitStreamRequest request) {
        AnalysisWindow window = request.getWindow();
        try {
            long rows = countHits(request);
            if (rows > properties.getMaxRowsScanned()) {
                log.warn("Refusing hit read for website {}: {} rows over limit {}",
                        window.getWebsiteId(), rows, properties.getMaxRowsScanned());
                throw new QueryResourceLimitException(rows, properties.getMaxRowsScanned());
            }
            if (rows == 0) {
                return List.of();
            }

            List<WebsiteEventEntity> events = eventRepository.findHits(
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    eventTypeCodes(request.getKinds()));

            Map<UUID, Map<String, List<String>>> parameters = request.isIncludeParameters()
                    ? loadParameters(request)
                    : Map.of();

            List<SessionHits> sessions = group(events, parameters);
            log.debug("Loaded {} hits in {} sessions for website {}", events.size(), sessions.size(), window.getWebsiteId());
            return sessions;

        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new WarehouseUnavailableException("Event warehouse is not reachable", e);
        }
    }

    @Override
    public long countHits(HitStreamRequest request) {
        AnalysisWindow window = request.getWindow();
        try {
            long hits = eventRepository.countHits(
                    window.getWebsiteId(),
                    window.getStartDate(),
                    window.getEndDate(),
                    eventTypeCodes(request.getKinds()));
            if (!request.isIncludeParameters()) {
                return hits;
            }
            long parameterRows = request.restrictsParameterKeys()
                    ? eventDataRepository.countInWindowForKeys(window.getWebsiteId(), window.getStartDate(),
                            window.getEndDate(), sortedKeys(request))
                    : eventDataRepository.countInWindow(window.getWebsiteId(), window.getStartDate(), window.getEndDate());
            return hits + parameterRows;
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new WarehouseUnavailableException("Event warehouse is not reachable", e);
        }
    }

    private Map<UUID, Map<String, List<String>>> loadParameters(HitStreamRequest request) {
        AnalysisWindow window = request.getWindow();
        List<EventDataEntity> rows = request.restrictsParameterKeys()
                ? eventDataRepository.findInWindowForKeys(window.getWebsiteId(), window.getStartDate(),
                        window.getEndDate(), sortedKeys(request))
                : eventDataRepository.findInWindow(window.getWebsiteId(), window.getStartDate(), window.getEndDate());

        Map<UUID, Map<String, List<String>>> byEvent = new HashMap<>();
        for (EventDataEntity data : rows) {
            byEvent.computeIfAbsent(data.getWebsiteEventId(), id -> new HashMap<>())
                    .computeIfAbsent(data.getDataKey(), key -> new ArrayList<>())
                    .add(data.getStringValue());
        }
        return byEvent;
    }

    private List<SessionHits> group(List<WebsiteEventEntity> events, Map<UUID, Map<String, List<String>>> parameters) {
        Map<UUID, List<NormalizedHit>> bySession = new LinkedHashMap<>();
        long sequence = 0;
        for (WebsiteEventEntity event : events) {
            NormalizedHit hit = toHit(event, sequence++, parameters.getOrDefault(event.getEventId(), Map.of()));
            bySession.computeIfAbsent(event.getSessionId(), id -> new ArrayList<>()).add(hit);
        }

        return bySession.entrySet().stream()
                .map(entry -> SessionHits.of(entry.getKey().toString(), entry.getValue()))
                .collect(Collectors.toList());
    }

    static NormalizedHit toHit(WebsiteEventEntity event, long sequence, Map<String, List<String>> parameters) {
        HitKind kind = HitKind.fromCode(event.getEventType());
        String page = UrlPathNormalizer.normalize(event.getUrlPath());

        return NormalizedHit.builder()
                .sessionId(event.getSessionId().toString())
                .timestamp(event.getCreatedAt())
                .sequence(sequence)
                .kind(kind)
                .pathOrName(kind == HitKind.PAGEVIEW ? page : event.getEventName())
                .pageContext(page)
                .parameters(parameters)
                .build();
    }

    private static List<String> sortedKeys(HitStreamRequest request) {
        return request.getParameterKeys().stream().sorted().collect(Collectors.toList());
    }

    private static List<Integer> eventTypeCodes(Set<HitKind> kinds) {
        return kinds.stream().map(HitKind::getCode).sorted().collect(Collectors.toList());
    }
}
