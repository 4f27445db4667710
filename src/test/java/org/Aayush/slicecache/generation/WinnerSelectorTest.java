package org.Aayush.slicecache.generation;

import org.Aayush.slicecache.signature.Signature;
import org.Aayush.slicecache.slice.AdmittedSlice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.Aayush.slicecache.testutil.SliceFixtures.NOV_1;
import static org.Aayush.slicecache.testutil.SliceFixtures.admit;
import static org.Aayush.slicecache.testutil.SliceFixtures.at;
import static org.Aayush.slicecache.testutil.SliceFixtures.signature;
import static org.Aayush.slicecache.testutil.SliceFixtures.slice;
import static org.Aayush.slicecache.testutil.SliceFixtures.uncontextedSignature;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WinnerSelector Tests")
class WinnerSelectorTest {
    private static final Signature SIG = signature(Map.of("channel", "ch-v1", "device", "dv-v1"));

    private final WinnerSelector selector = new WinnerSelector();

    @Test
    @DisplayName("No candidates ranks nothing")
    void testEmpty() {
        assertTrue(selector.rank(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Exact candidate beats a fresher reduction")
    void testExactBeatsFresherReduction() {
        DateCandidate exact = candidate(admit(slice("total", Map.of(), uncontextedSignature(), at(5), 1, 1, NOV_1)),
                CoverageKind.EXACT, at(5));
        DateCandidate reduction = candidate(admit(slice("google", Map.of("channel", "google"), SIG, at(20), 1, 1, NOV_1)),
                CoverageKind.REDUCTION, at(20));

        assertEquals(exact, selector.rank(List.of(reduction, exact)).get(0));
    }

    @Test
    @DisplayName("Among reductions the freshest recency wins")
    void testFreshestReductionWins() {
        DateCandidate channel = candidate(admit(slice("google", Map.of("channel", "google"), SIG, at(10), 1, 1, NOV_1)),
                CoverageKind.REDUCTION, at(10));
        DateCandidate device = candidate(admit(slice("ios", Map.of("device", "ios"), SIG, at(12), 1, 1, NOV_1)),
                CoverageKind.REDUCTION, at(12));

        assertEquals(device, selector.rank(List.of(channel, device)).get(0));
    }

    @Test
    @DisplayName("Equal recency falls back to key set label order")
    void testTieBreakByLabel() {
        Instant recency = at(10);
        DateCandidate channel = candidate(admit(slice("google", Map.of("channel", "google"), SIG, recency, 1, 1, NOV_1)),
                CoverageKind.REDUCTION, recency);
        DateCandidate device = candidate(admit(slice("ios", Map.of("device", "ios"), SIG, recency, 1, 1, NOV_1)),
                CoverageKind.REDUCTION, recency);

        assertEquals(channel, selector.rank(List.of(device, channel)).get(0));
        assertEquals(channel, selector.rank(List.of(channel, device)).get(0));
    }

    @Test
    @DisplayName("Ranking keeps every candidate with fallbacks after the winner")
    void testRankKeepsFallbacksInOrder() {
        DateCandidate exact = candidate(admit(slice("total", Map.of(), uncontextedSignature(), at(5), 1, 1, NOV_1)),
                CoverageKind.EXACT, at(5));
        DateCandidate staleChannel = candidate(admit(slice("google", Map.of("channel", "google"), SIG, at(8), 1, 1, NOV_1)),
                CoverageKind.REDUCTION, at(8));
        DateCandidate freshDevice = candidate(admit(slice("ios", Map.of("device", "ios"), SIG, at(12), 1, 1, NOV_1)),
                CoverageKind.REDUCTION, at(12));

        assertEquals(
                List.of(exact, freshDevice, staleChannel),
                selector.rank(List.of(staleChannel, exact, freshDevice))
        );
    }

    private static DateCandidate candidate(AdmittedSlice slice, CoverageKind kind, Instant recency) {
        Generation generation = new DimensionGrouping().group(List.of(slice)).get(0);
        return new DateCandidate(
                generation,
                kind,
                NOV_1,
                List.copyOf(generation.cellsOn(NOV_1).values()),
                recency
        );
    }
}
