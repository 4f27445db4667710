package org.Aayush.slicecache.generation;

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
import static org.Aayush.slicecache.testutil.SliceFixtures.uncontextedSignature;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DimensionGrouping Tests")
class DimensionGroupingTest {
    private final DimensionGrouping grouping = new DimensionGrouping();

    @Test
    @DisplayName("Slices split by key set and sorted by key set label")
    void testGroupByKeySet() {
        Signature sig = signature(Map.of("channel", "ch-v1", "device", "dv-v1"));
        List<Generation> generations = grouping.group(List.of(
                admit(slice("ios", Map.of("device", "ios"), sig, at(10), 1, 1, NOV_1)),
                admit(slice("google", Map.of("channel", "google"), sig, at(10), 1, 1, NOV_1)),
                admit(slice("total", Map.of(), uncontextedSignature(), at(10), 1, 1, NOV_1)),
                admit(slice("meta", Map.of("channel", "meta"), sig, at(10), 1, 1, NOV_1)),
                admit(slice("g-ios", Map.of("channel", "google", "device", "ios"), sig, at(10), 1, 1, NOV_1))
        ));

        assertEquals(List.of("", "channel", "channel|device", "device"),
                generations.stream().map(generation -> generation.key().keySetLabel()).toList());
        assertEquals(2, generations.get(1).members().size());
        assertEquals(Map.of("channel", "ch-v1"), generations.get(1).bundle().contextHashes());
        assertTrue(generations.get(0).bundle().contextHashes().isEmpty());
    }

    @Test
    @DisplayName("Different taxonomy hashes for the same key set form separate generations")
    void testSplitBySignatureBundle() {
        List<Generation> generations = grouping.group(List.of(
                admit(slice("google-v1", Map.of("channel", "google"), signature(Map.of("channel", "v1")), at(10), 1, 1, NOV_1)),
                admit(slice("meta-v2", Map.of("channel", "meta"), signature(Map.of("channel", "v2")), at(10), 1, 1, NOV_1)),
                admit(slice("meta-v1", Map.of("channel", "meta"), signature(Map.of("channel", "v1", "device", "x")), at(10), 1, 1, NOV_1))
        ));

        assertEquals(2, generations.size());
        assertEquals(List.of("google-v1", "meta-v1"),
                generations.get(0).members().stream().map(member -> member.sliceId()).toList());
        assertEquals(List.of("meta-v2"),
                generations.get(1).members().stream().map(member -> member.sliceId()).toList());
    }

    @Test
    @DisplayName("Cells on a date prefer the freshest member for a repeated cell")
    void testCellsOnPrefersFreshest() {
        Signature sig = signature(Map.of("channel", "ch-v1"));
        Generation generation = grouping.group(List.of(
                admit(slice("google-early", Map.of("channel", "google"), sig, at(8))
                        .point(point(NOV_1, 10, 1)).point(point(NOV_2, 20, 2)).windowFrom(NOV_1).windowTo(NOV_2).build()),
                admit(slice("google-late", Map.of("channel", "google"), sig, at(11))
                        .point(point(NOV_2, 25, 3)).windowFrom(NOV_2).windowTo(NOV_2).build())
        )).get(0);

        assertEquals("google-early", generation.cellsOn(NOV_1).get("channel:google").slice().sliceId());
        assertEquals("google-late", generation.cellsOn(NOV_2).get("channel:google").slice().sliceId());
        assertEquals(25L, generation.cellsOn(NOV_2).get("channel:google").point().getN());
        assertTrue(generation.cellsOn(NOV_2.plusDays(1)).isEmpty());
    }
}
