package org.Aayush.slicecache.signature;

import org.Aayush.slicecache.core.CoverageFailure;
import org.Aayush.slicecache.core.CoverageReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SignatureCompatibilityFilter Tests")
class SignatureCompatibilityFilterTest {
    private final SignatureCompatibilityFilter filter = new SignatureCompatibilityFilter();

    @Test
    @DisplayName("Differing core hash is rejected before any dimension")
    void testCoreHashMismatch() {
        CompatibilityVerdict verdict = filter.check(
                Signature.of("core-a", Map.of("channel", Signature.HASH_MISSING)),
                Signature.of("core-b"),
                List.of("channel")
        );

        assertFalse(verdict.compatible());
        assertEquals("signature_incompatible:core_hash_mismatch", verdict.reasonCode());
        assertNull(verdict.dimension());
    }

    @Test
    @DisplayName("Slice hash for a dimension the query does not pin is accepted")
    void testUnpinnedSliceDimensionAccepted() {
        CompatibilityVerdict verdict = filter.check(
                Signature.of("core", Map.of("channel", "ch-1")),
                Signature.of("core"),
                List.of("channel")
        );

        assertSame(CompatibilityVerdict.COMPATIBLE, verdict);
        assertNull(verdict.reasonCode());
    }

    @Test
    @DisplayName("Query-pinned hash absent or different on the slice is a definition change")
    void testDefinitionChanged() {
        Signature query = Signature.of("core", Map.of("channel", "ch-2"));

        CompatibilityVerdict differing = filter.check(Signature.of("core", Map.of("channel", "ch-1")), query, List.of("channel"));
        CompatibilityVerdict absent = filter.check(Signature.of("core"), query, List.of("channel"));

        assertEquals("context_definition_changed", differing.reasonCode());
        assertEquals("channel", differing.dimension());
        assertEquals("context_definition_changed", absent.reasonCode());
    }

    @Test
    @DisplayName("Sentinel hash on either side is reported as unavailable for that key")
    void testSentinelUnavailable() {
        CompatibilityVerdict sliceSide = filter.check(
                Signature.of("core", Map.of("channel", Signature.HASH_ERROR)),
                Signature.of("core", Map.of("channel", Signature.HASH_ERROR)),
                List.of("channel")
        );
        CompatibilityVerdict querySide = filter.check(
                Signature.of("core", Map.of("device", "dv")),
                Signature.of("core", Map.of("device", Signature.HASH_MISSING)),
                List.of("device")
        );

        assertEquals("context_hash_unavailable:channel", sliceSide.reasonCode());
        assertEquals("context_hash_unavailable:device", querySide.reasonCode());
    }

    @Test
    @DisplayName("Keys outside the relevant set are ignored and keys are checked in sorted order")
    void testRelevantKeysOnly() {
        Signature slice = Signature.of("core", Map.of("zone", "z-old", "channel", "c-old"));
        Signature query = Signature.of("core", Map.of("zone", "z-new", "channel", "c-new"));

        assertSame(CompatibilityVerdict.COMPATIBLE, filter.check(slice, query, List.of()));
        assertEquals("channel", filter.check(slice, query, List.of("zone", "channel")).dimension());
    }

    @Test
    @DisplayName("Rejection converts into a per-date failure attributed to the slice")
    void testToFailure() {
        CompatibilityVerdict verdict = filter.check(
                Signature.of("core", Map.of("channel", Signature.HASH_MISSING)),
                Signature.of("core"),
                List.of("channel")
        );

        CoverageFailure failure = verdict.toFailure("slice-7");

        assertEquals(CoverageReason.CONTEXT_HASH_UNAVAILABLE, failure.reason());
        assertEquals("context_hash_unavailable:channel", failure.code());
        assertEquals("slice-7", failure.detail().get("sliceId"));
        assertThrows(IllegalStateException.class, () -> CompatibilityVerdict.COMPATIBLE.toFailure("x"));
    }
}
