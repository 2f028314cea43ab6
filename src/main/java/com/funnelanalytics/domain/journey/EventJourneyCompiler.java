package com.funnelanalytics.domain.journey;

import com.funnelanalytics.config.AnalysisProperties;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.model.SessionHits;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks the sequences of custom events sessions fired on a page.
 *
 * Flow:
 * 1. Label each event on the page: its name, then its parameters as {@code key: value} joined by {@code ||}
 * 2. Order the session's events by time, then navigation events last, then label
 * 3. Collapse runs of identical events (same name and same parameters)
 * 4. Keep sessions with at least {@code minEvents} events and, when filtered, one of the filtered events
 * 5. Count sessions per distinct path, most frequent first, capped
 *
 * Alongside, every session with a pageview of the page is classed as interacting,
 * navigating on without events, or bouncing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventJourneyCompiler {

    static final String PARAMETER_SEPARATOR = "||";

    private static final Comparator<EventPath> BY_COUNT =
            Comparator.comparingLong(EventPath::getCount).reversed()
                    .thenComparing(path -> String.join("\n", path.getPath()));

    private final AnalysisProperties analysisProperties;

    public EventJourney compile(Collection<SessionHits> sessions, EventJourneyQuery query) {
        AnalysisProperties.EventJourney settings = analysisProperties.getEventJourney();
        Set<String> ignoredKeys = settings.getIgnoredKeys().stream()
                .map(key -> key.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Comparator<LabelledEvent> order = Comparator.comparing(LabelledEvent::getTimestamp)
                .thenComparing(event -> event.isNavigation(settings.getNavigationKey()))
                .thenComparing(LabelledEvent::getName)
                .thenComparing(LabelledEvent::getParameters, Comparator.nullsFirst(Comparator.<String>naturalOrder()));

        Map<List<String>, Long> pathCounts = new HashMap<>();
        EventJourneyStats stats = EventJourneyStats.empty();

        for (SessionHits session : sessions) {
            List<NormalizedHit> events = session.getHits().stream()
                    .filter(hit -> hit.getKind() == HitKind.EVENT && hit.getPathOrName() != null)
                    .filter(hit -> query.coversPage(hit.getPageContext()))
                    .collect(Collectors.toList());

            classify(session, events, query, stats);

            if (events.isEmpty() || !containsFilteredEvent(events, query.getEventFilter())) {
                continue;
            }

            List<LabelledEvent> labelled = events.stream()
                    .map(hit -> label(hit, ignoredKeys, settings.getLeadingKeys()))
                    .sorted(order)
                    .collect(Collectors.toList());
            List<String> path = collapseRepeats(labelled);
            if (path.size() >= query.getMinEvents()) {
                pathCounts.merge(path, 1L, Long::sum);
            }
        }

        List<EventPath> ranked = pathCounts.entrySet().stream()
                .map(entry -> new EventPath(List.copyOf(entry.getKey()), entry.getValue()))
                .sorted(BY_COUNT)
                .limit(settings.getMaxPaths())
                .collect(Collectors.toList());

        log.debug("Event journeys on {}: {} distinct paths, {} returned, {} sessions on page",
                query.getPage(), pathCounts.size(), ranked.size(), stats.getTotalSessions());
        return new EventJourney(ranked, stats);
    }

    private void classify(SessionHits session, List<NormalizedHit> events, EventJourneyQuery query, EventJourneyStats stats) {
        List<NormalizedHit> pageviews = session.hitsOfKind(HitKind.PAGEVIEW);
        Instant firstVisit = pageviews.stream()
                .filter(hit -> query.coversPage(hit.getPathOrName()))
                .map(NormalizedHit::getTimestamp)
                .findFirst()
                .orElse(null);
        if (firstVisit == null) {
            return;
        }

        stats.setTotalSessions(stats.getTotalSessions() + 1);
        if (!events.isEmpty()) {
            stats.setSessionsWithEvents(stats.getSessionsWithEvents() + 1);
        } else if (pageviews.stream().anyMatch(hit -> hit.getTimestamp().isAfter(firstVisit))) {
            stats.setSessionsNoEventsNavigated(stats.getSessionsNoEventsNavigated() + 1);
        } else {
            stats.setSessionsNoEventsBounced(stats.getSessionsNoEventsBounced() + 1);
        }
    }

    private static boolean containsFilteredEvent(List<NormalizedHit> events, Set<String> eventFilter) {
        return eventFilter.isEmpty()
                || events.stream().anyMatch(hit -> eventFilter.contains(hit.getPathOrName()));
    }

    static LabelledEvent label(NormalizedHit hit, Set<String> ignoredKeys, List<String> leadingKeys) {
        Comparator<String> keyOrder = Comparator.comparing((String key) -> leadingKeys.contains(key) ? 0 : 1)
                .thenComparing(Comparator.<String>naturalOrder());

        List<String> parts = new ArrayList<>();
        hit.getParameters().keySet().stream()
                .filter(key -> !ignoredKeys.contains(key.toLowerCase(Locale.ROOT)))
                .sorted(keyOrder)
                .forEach(key -> hit.parameterValues(key).stream()
                        .filter(Objects::nonNull)
                        .forEach(value -> parts.add(key + ": " + value.replace(PARAMETER_SEPARATOR, " "))));

        String parameters = parts.isEmpty() ? null : String.join(PARAMETER_SEPARATOR, parts);
        return new LabelledEvent(hit.getTimestamp(), hit.getPathOrName(), parameters);
    }

    private static List<String> collapseRepeats(List<LabelledEvent> events) {
        List<String> path = new ArrayList<>();
        LabelledEvent previous = null;
        for (LabelledEvent event : events) {
            if (previous == null || !event.sameAs(previous)) {
                path.add(event.text());
            }
            previous = event;
        }
        return path;
    }

    @Value
    static class LabelledEvent {
        Instant timestamp;
        String name;

        /** {@code key: value} pairs joined by {@code ||}, {@code null} when the event has none. */
        String parameters;

        boolean isNavigation(String navigationKey) {
            return parameters != null && parameters.contains(navigationKey + ":");
        }

        boolean sameAs(LabelledEvent other) {
            return name.equals(other.name)
                    && Objects.equals(Objects.toString(parameters, ""), Objects.toString(other.parameters, ""));
        }

        String text() {
            return parameters == null ? name : name + ": " + parameters;
        }
    }
}
