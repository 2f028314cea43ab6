package com.funnelanalytics.domain.timing;

import com.funnelanalytics.domain.HitFixtures;
import com.funnelanalytics.domain.model.EntryMode;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.NormalizedHit;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.funnelanalytics.domain.HitFixtures.BASE;
import static org.junit.jupiter.api.Assertions.*;

class SessionTimingMatcherTest {

    private final SessionTimingMatcher matcher = new SessionTimingMatcher();

    @Test
    void testMatch_StrictAdjacentPair() {
        // Given
        List<NormalizedHit> hits = HitFixtures.session("s1").page("/a", 0).page("/b", 5).build().getHits();

        // When
        SessionTimingMatch match = matcher.match(hits, List.of("/a", "/b"), EntryMode.STRICT);

        // Then
        assertTrue(match.isComplete());
        List<TransitionRecord> records = match.transitions();
        assertEquals(2, records.size());
        assertEquals(new TransitionRecord(0, "/a", "/b", 5), records.get(0));
        assertTrue(records.get(1).isTotal());
        assertEquals(5, records.get(1).getDiffSeconds());
    }

    @Test
    void testMatch_StrictStopsAtGap() {
        List<NormalizedHit> hits = HitFixtures.session("s1")
                .page("/a", 0).page("/x", 3).page("/b", 5).page("/c", 9)
                .build().getHits();

        SessionTimingMatch match = matcher.match(hits, List.of("/a", "/b", "/c"), EntryMode.STRICT);

        assertTrue(match.isMatched());
        assertFalse(match.isComplete());
        assertEquals(List.of(BASE), match.getMatchedTimestamps());
        assertTrue(match.transitions().isEmpty());
    }

    @Test
    void testMatch_LooseSkipsGapAndTotals() {
        List<NormalizedHit> hits = HitFixtures.session("s1")
                .page("/a", 0).page("/x", 3).page("/b", 5).page("/c", 9)
                .build().getHits();

        List<TransitionRecord> records = matcher.match(hits, List.of("/a", "/b", "/c"), EntryMode.LOOSE).transitions();

        assertEquals(3, records.size());
        assertEquals(5, records.get(0).getDiffSeconds());
        assertEquals(4, records.get(1).getDiffSeconds());
        assertEquals(9, records.get(2).getDiffSeconds());
        assertEquals("Total", records.get(2).getFromValue());
    }

    @Test
    void testMatch_PartialChainHasNoTotal() {
        List<NormalizedHit> hits = HitFixtures.session("s1").page("/a", 0).page("/b", 7).build().getHits();

        List<TransitionRecord> records = matcher.match(hits, List.of("/a", "/b", "/c"), EntryMode.LOOSE).transitions();

        assertEquals(1, records.size());
        assertFalse(records.get(0).isTotal());
    }

    @Test
    void testMatch_AnchorsOnFirstOccurrence() {
        List<NormalizedHit> hits = HitFixtures.session("s1")
                .page("/a", 0).page("/x", 10).page("/a", 20).page("/b", 25)
                .build().getHits();

        // first /a is followed by /x, so strict never retries from the second /a
        assertFalse(matcher.match(hits, List.of("/a", "/b"), EntryMode.STRICT).isComplete());
        assertEquals(25, matcher.match(hits, List.of("/a", "/b"), EntryMode.LOOSE).transitions().get(0).getDiffSeconds());
    }

    @Test
    void testMatch_NoAnchor() {
        List<NormalizedHit> hits = HitFixtures.session("s1").page("/x", 0).page("/b", 5).build().getHits();

        SessionTimingMatch match = matcher.match(hits, List.of("/a", "/b"), EntryMode.LOOSE);

        assertFalse(match.isMatched());
        assertTrue(match.transitions().isEmpty());
    }

    @Test
    void testMatch_RoundsToWholeSeconds() {
        List<NormalizedHit> hits = List.of(
                hit("/a", BASE, 0),
                hit("/b", BASE.plusMillis(2_600), 1));

        assertEquals(3, matcher.match(hits, List.of("/a", "/b"), EntryMode.STRICT).transitions().get(0).getDiffSeconds());
    }

    @Test
    void testMatch_Deterministic() {
        List<NormalizedHit> hits = HitFixtures.session("s1")
                .page("/a", 0).page("/b", 4).page("/a", 6).page("/b", 8).page("/c", 12)
                .build().getHits();
        List<String> steps = List.of("/a", "/b", "/c");

        SessionTimingMatch first = matcher.match(hits, steps, EntryMode.LOOSE);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, matcher.match(hits, steps, EntryMode.LOOSE));
        }
    }

    @Test
    void testMatch_EmptyInput() {
        assertFalse(matcher.match(List.of(), List.of("/a", "/b"), EntryMode.STRICT).isMatched());
        assertFalse(matcher.match(null, List.of("/a", "/b"), EntryMode.STRICT).isMatched());
    }

    private static NormalizedHit hit(String path, Instant at, long sequence) {
        return NormalizedHit.builder()
                .sessionId("s")
                .timestamp(at)
                .sequence(sequence)
                .kind(HitKind.PAGEVIEW)
                .pathOrName(path)
                .pageContext(path)
                .build();
    }
}
