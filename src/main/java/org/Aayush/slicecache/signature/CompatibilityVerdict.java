package org.Aayush.slicecache.signature;

import org.Aayush.slicecache.core.CoverageFailure;
import org.Aayush.slicecache.core.CoverageReason;

import java.util.Map;

/**
 * Outcome of one slice-versus-query signature comparison.
 *
 * @param compatible whether the slice may answer the query.
 * @param reason rejection reason, {@code null} when compatible.
 * @param dimension dimension that caused a dimensional rejection, otherwise {@code null}.
 */
public record CompatibilityVerdict(boolean compatible, CoverageReason reason, String dimension) {
    public static final CompatibilityVerdict COMPATIBLE = new CompatibilityVerdict(true, null, null);

    static CompatibilityVerdict coreHashMismatch() {
        return new CompatibilityVerdict(false, CoverageReason.SIGNATURE_CORE_HASH_MISMATCH, null);
    }

    static CompatibilityVerdict hashUnavailable(String dimension) {
        return new CompatibilityVerdict(false, CoverageReason.CONTEXT_HASH_UNAVAILABLE, dimension);
    }

    static CompatibilityVerdict definitionChanged(String dimension) {
        return new CompatibilityVerdict(false, CoverageReason.CONTEXT_DEFINITION_CHANGED, dimension);
    }

    /**
     * Returns stable wire code, or {@code null} when compatible.
     */
    public String reasonCode() {
        return compatible ? null : reason.code(dimension);
    }

    /**
     * Converts a rejection into a per-date coverage failure attributed to one slice.
     */
    public CoverageFailure toFailure(String sliceId) {
        if (compatible) {
            throw new IllegalStateException("compatible verdict has no failure");
        }
        Map<String, String> detail = dimension == null
                ? Map.of("sliceId", sliceId)
                : Map.of("sliceId", sliceId, "dimension", dimension);
        return reason.dimensional()
                ? CoverageFailure.forDimension(reason, dimension, detail)
                : CoverageFailure.of(reason, detail);
    }
}
