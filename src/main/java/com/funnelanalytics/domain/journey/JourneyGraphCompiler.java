package com.funnelanalytics.domain.journey;

import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.JourneyDirection;
import com.funnelanalytics.domain.model.NormalizedHit;
import com.funnelanalytics.domain.model.SessionHits;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Builds the page flow graph around a start page.
 *
 * Flow:
 * 1. Anchor each session on its first pageview of the start page
 * 2. Walk outward (forward: later pages, backward: earlier pages) up to the horizon,
 *    one (step, source, target) triple per consecutive pair
 * 3. Drop self-transitions, and any step &gt; 0 touching the start page again
 * 4. Count sessions per triple, keep the top N per step
 * 5. Keep a step &gt; 0 edge only if its source is a target of a kept edge one step earlier
 * 6. Assign node ids per (step, page) in order of first appearance
 *
 * Pruning per step bounds the output to horizon x N edges while keeping the dominant paths.
 */
@Slf4j
@Component
public class JourneyGraphCompiler {

    private static final Comparator<JourneyFlow> BY_WEIGHT =
            Comparator.comparingLong(JourneyFlow::getWeight).reversed()
                    .thenComparing(JourneyFlow::getSource)
                    .thenComparing(JourneyFlow::getTarget);

    public JourneyGraph compile(Collection<SessionHits> sessions, JourneyQuery query) {
        Map<FlowKey, Long> weights = countFlows(sessions, query);
        if (weights.isEmpty()) {
            return JourneyGraph.empty();
        }

        List<JourneyFlow> retained = prune(weights, query);
        log.debug("Journey from {} ({}): {} distinct flows, {} retained",
                query.getStartUrl(), query.getDirection(), weights.size(), retained.size());

        return assemble(retained);
    }

    Map<FlowKey, Long> countFlows(Collection<SessionHits> sessions, JourneyQuery query) {
        String start = query.getStartUrl();
        boolean forward = query.getDirection() == JourneyDirection.FORWARD;
        Map<FlowKey, Long> weights = new HashMap<>();

        for (SessionHits session : sessions) {
            List<String> pages = session.hitsOfKind(HitKind.PAGEVIEW).stream()
                    .map(NormalizedHit::getPathOrName)
                    .collect(Collectors.toList());

            int anchor = pages.indexOf(start);
            if (anchor < 0) {
                continue;
            }

            for (int step = 0; step < query.getHorizon(); step++) {
                int sourceIndex = forward ? anchor + step : anchor - step;
                int targetIndex = forward ? sourceIndex + 1 : sourceIndex - 1;
                if (targetIndex < 0 || targetIndex >= pages.size()) {
                    break;
                }

                String source = pages.get(sourceIndex);
                String target = pages.get(targetIndex);
                if (source.equals(target)) {
                    continue;
                }
                if (step > 0 && (source.equals(start) || target.equals(start))) {
                    continue;
                }

                weights.merge(new FlowKey(step, source, target), 1L, Long::sum);
            }
        }
        return weights;
    }

    List<JourneyFlow> prune(Map<FlowKey, Long> weights, JourneyQuery query) {
        Map<Integer, List<JourneyFlow>> byStep = new TreeMap<>();
        weights.forEach((key, weight) -> byStep
                .computeIfAbsent(key.getStep(), step -> new ArrayList<>())
                .add(new JourneyFlow(key.getStep(), key.getSource(), key.getTarget(), weight)));

        List<JourneyFlow> retained = new ArrayList<>();
        Set<String> reachable = Set.of(query.getStartUrl());

        for (int step = 0; step < query.getHorizon() && !reachable.isEmpty(); step++) {
            List<JourneyFlow> candidates = byStep.getOrDefault(step, List.of());
            Set<String> nextReachable = new HashSet<>();

            List<JourneyFlow> top = candidates.stream()
                    .sorted(BY_WEIGHT)
                    .limit(query.getEdgeCap())
                    .collect(Collectors.toList());

            for (JourneyFlow flow : top) {
                if (reachable.contains(flow.getSource())) {
                    retained.add(flow);
                    nextReachable.add(flow.getTarget());
                }
            }
            reachable = nextReachable;
        }
        return retained;
    }

    private JourneyGraph assemble(List<JourneyFlow> flows) {
        Map<String, JourneyNode> nodes = new LinkedHashMap<>();
        List<JourneyEdge> links = new ArrayList<>(flows.size());

        for (JourneyFlow flow : flows) {
            JourneyNode source = node(nodes, flow.getStep(), flow.getSource());
            JourneyNode target = node(nodes, flow.getStep() + 1, flow.getTarget());
            links.add(new JourneyEdge(source.getId(), target.getId(), flow.getWeight()));
        }
        return new JourneyGraph(List.copyOf(nodes.values()), links);
    }

    private JourneyNode node(Map<String, JourneyNode> nodes, int step, String page) {
        String nodeId = step + ":" + page;
        return nodes.computeIfAbsent(nodeId, id -> new JourneyNode(nodes.size(), id, step, page));
    }

    @Value
    static class FlowKey {
        int step;
        String source;
        String target;
    }
}
