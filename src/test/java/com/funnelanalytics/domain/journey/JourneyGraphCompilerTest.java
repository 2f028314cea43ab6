package com.funnelanalytics.domain.journey;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.JourneyDirection;
import com.funnelanalytics.domain.model.SessionHits;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.funnelanalytics.domain.HitFixtures.pages;
import static org.junit.jupiter.api.Assertions.*;

class JourneyGraphCompilerTest {

    private static final AnalysisWindow WINDOW = AnalysisWindow.of(
            UUID.randomUUID(), Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-08T00:00:00Z"));

    private final JourneyGraphCompiler compiler = new JourneyGraphCompiler();

    @Test
    void testCompile_SplitAfterSecondPage() {
        // Given: everyone goes /a -> /b, half continue to /c
        List<SessionHits> sessions = List.of(
                pages("s1", "/a", "/b"),
                pages("s2", "/a", "/b"),
                pages("s3", "/a", "/b", "/c"),
                pages("s4", "/a", "/b", "/c"));

        // When
        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 2, 5));

        // Then
        assertEquals(List.of("0:/a", "1:/b", "2:/c"), nodeIds(graph));
        assertEquals(2, graph.getLinks().size());
        assertEquals(new JourneyEdge(0, 1, 4), graph.getLinks().get(0));
        assertEquals(new JourneyEdge(1, 2, 2), graph.getLinks().get(1));
    }

    @Test
    void testCompile_NodeIdsAreStepScoped() {
        List<SessionHits> sessions = List.of(pages("s1", "/a", "/b", "/c", "/b"));

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 3, 5));

        assertEquals(List.of("0:/a", "1:/b", "2:/c", "3:/b"), nodeIds(graph));
        for (int i = 0; i < graph.getNodes().size(); i++) {
            assertEquals(i, graph.getNodes().get(i).getId());
        }
    }

    @Test
    void testCompile_NoSelfLoops() {
        List<SessionHits> sessions = List.of(
                pages("s1", "/a", "/b", "/b", "/c"),
                pages("s2", "/a", "/a", "/b"));

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 3, 10));

        Map<Integer, String> names = new HashMap<>();
        graph.getNodes().forEach(node -> names.put(node.getId(), node.getName()));
        assertFalse(graph.isEmpty());
        for (JourneyEdge edge : graph.getLinks()) {
            assertNotEquals(names.get(edge.getSource()), names.get(edge.getTarget()));
        }
    }

    @Test
    void testCompile_CapsEdgesPerStepWithStableTies() {
        List<SessionHits> sessions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            sessions.add(pages("p1-" + i, "/a", "/p1"));
        }
        for (int i = 0; i < 2; i++) {
            sessions.add(pages("p2-" + i, "/a", "/p2"));
        }
        for (String page : List.of("/z", "/m", "/c", "/q")) {
            sessions.add(pages("once" + page, "/a", page));
        }

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 1, 3));

        assertEquals(3, graph.getLinks().size());
        assertEquals(List.of("0:/a", "1:/p1", "1:/p2", "1:/c"), nodeIds(graph));
        assertEquals(3, graph.getLinks().get(0).getValue());
        assertEquals(1, graph.getLinks().get(2).getValue());
    }

    @Test
    void testCompile_Backward() {
        List<SessionHits> sessions = List.of(
                pages("s1", "/x", "/y", "/a"),
                pages("s2", "/w", "/y", "/a", "/b"));

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.BACKWARD, 2, 5));

        assertEquals("0:/a", graph.getNodes().get(0).getNodeId());
        assertEquals(new JourneyEdge(0, 1, 2), graph.getLinks().get(0));
        assertEquals("1:/y", graph.getNodes().get(1).getNodeId());
        Set<String> stepTwo = new HashSet<>();
        graph.getNodes().stream().filter(node -> node.getStepIndex() == 2).forEach(node -> stepTwo.add(node.getName()));
        assertEquals(Set.of("/w", "/x"), stepTwo);
    }

    @Test
    void testCompile_DropsEdgesFromPrunedPages() {
        // /d -> /e outweighs /b -> /c at step 1, but /d did not survive step 0
        List<SessionHits> sessions = List.of(
                pages("s1", "/a", "/b", "/c"),
                pages("s2", "/a", "/b"),
                pages("s3", "/a", "/b"),
                pages("s4", "/a", "/d", "/e"),
                pages("s5", "/a", "/d", "/e"));

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 2, 1));

        assertEquals(List.of("0:/a", "1:/b"), nodeIds(graph));
        assertEquals(1, graph.getLinks().size());
        assertNoDanglingEdges(graph);
    }

    @Test
    void testCompile_IgnoresReturnsToStartPage() {
        List<SessionHits> sessions = List.of(pages("s1", "/a", "/b", "/a", "/c"));

        JourneyGraph graph = compiler.compile(sessions, query("/a", JourneyDirection.FORWARD, 3, 5));

        assertEquals(List.of("0:/a", "1:/b"), nodeIds(graph));
    }

    @Test
    void testCompile_NoSessionReachesStart() {
        JourneyGraph graph = compiler.compile(
                List.of(pages("s1", "/x", "/y")), query("/a", JourneyDirection.FORWARD, 3, 5));

        assertTrue(graph.isEmpty());
        assertTrue(graph.getNodes().isEmpty());
    }

    private static void assertNoDanglingEdges(JourneyGraph graph) {
        Map<Integer, Integer> steps = new HashMap<>();
        graph.getNodes().forEach(node -> steps.put(node.getId(), node.getStepIndex()));
        Set<Integer> targets = new HashSet<>();
        graph.getLinks().forEach(edge -> targets.add(edge.getTarget()));
        for (JourneyEdge edge : graph.getLinks()) {
            if (steps.get(edge.getSource()) > 0) {
                assertTrue(targets.contains(edge.getSource()), "edge from unreached node " + edge.getSource());
            }
        }
    }

    private static List<String> nodeIds(JourneyGraph graph) {
        List<String> ids = new ArrayList<>();
        graph.getNodes().forEach(node -> ids.add(node.getNodeId()));
        return ids;
    }

    private static JourneyQuery query(String start, JourneyDirection direction, int horizon, int cap) {
        return new JourneyQuery(WINDOW, start, direction, horizon, cap);
    }
}
