package org.Aayush.slicecache.slice;

import org.Aayush.slicecache.signature.Signature;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.Aayush.slicecache.testutil.SliceFixtures.NOV_1;
import static org.Aayush.slicecache.testutil.SliceFixtures.NOV_2;
import static org.Aayush.slicecache.testutil.SliceFixtures.admit;
import static org.Aayush.slicecache.testutil.SliceFixtures.at;
import static org.Aayush.slicecache.testutil.SliceFixtures.point;
import static org.Aayush.slicecache.testutil.SliceFixtures.signature;
import static org.Aayush.slicecache.testutil.SliceFixtures.slice;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SliceDeduplicator Tests")
class SliceDeduplicatorTest {
    private static final Signature SIG = signature(Map.of("channel", "ch-v1"));

    private final SliceDeduplicator deduplicator = new SliceDeduplicator();

    @Test
    @DisplayName("Newest retrieval survives among duplicates")
    void testNewestSurvives() {
        SliceDeduplicator.Result result = deduplicator.dedupe(List.of(
                admit(slice("old", Map.of("channel", "google"), SIG, at(8), 1, 1, NOV_1)),
                admit(slice("new", Map.of("channel", "google"), SIG, at(12), 2, 2, NOV_1)),
                admit(slice("mid", Map.of("channel", "google"), SIG, at(10), 3, 3, NOV_1))
        ));

        assertEquals(2, result.removed());
        assertEquals(1, result.retained().size());
        assertEquals("new", result.retained().get(0).sliceId());
    }

    @Test
    @DisplayName("Retrieval tie keeps the smaller slice id in any input order")
    void testTieKeepsSmallerId() {
        AdmittedSlice b = admit(slice("b", Map.of("channel", "google"), SIG, at(10), 1, 1, NOV_1));
        AdmittedSlice a = admit(slice("a", Map.of("channel", "google"), SIG, at(10), 2, 2, NOV_1));

        assertEquals("a", deduplicator.dedupe(List.of(a, b)).retained().get(0).sliceId());
        assertEquals("a", deduplicator.dedupe(List.of(b, a)).retained().get(0).sliceId());
    }

    @Test
    @DisplayName("Different coordinates, signatures or windows are not duplicates")
    void testDistinctKeysRetained() {
        SliceDeduplicator.Result result = deduplicator.dedupe(List.of(
                admit(slice("google", Map.of("channel", "google"), SIG, at(10), 1, 1, NOV_1)),
                admit(slice("meta", Map.of("channel", "meta"), SIG, at(10), 1, 1, NOV_1)),
                admit(slice("google-v2", Map.of("channel", "google"), signature(Map.of("channel", "ch-v2")), at(10), 1, 1, NOV_1)),
                admit(slice("google-window", Map.of("channel", "google"), SIG, at(10))
                        .point(point(NOV_2, 1, 1))
                        .windowFrom(NOV_1)
                        .windowTo(NOV_2)
                        .build())
        ));

        assertEquals(0, result.removed());
        assertEquals(List.of("google", "meta", "google-v2", "google-window"),
                result.retained().stream().map(AdmittedSlice::sliceId).toList());
    }
}
