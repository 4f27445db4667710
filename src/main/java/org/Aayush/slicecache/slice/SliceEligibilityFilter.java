package org.Aayush.slicecache.slice;

import org.Aayush.slicecache.core.CoverageReason;
import org.Aayush.slicecache.core.SliceDiagnostic;
import org.Aayush.slicecache.signature.Signature;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stage 2 filter: admits only structurally sound slices whose constraints can take part in
 * a provably complete partition.
 */
public final class SliceEligibilityFilter {

    /**
     * Evaluates one signature-compatible slice.
     *
     * @param slice caller slice.
     * @param signature parsed slice signature.
     * @param label identifier used in diagnostics when the slice has no id.
     * @return admitted slice or an exclusion diagnostic.
     */
    public Eligibility evaluate(Slice slice, Signature signature, String label) {
        Objects.requireNonNull(signature, "signature");
        String id = label;
        if (slice == null) {
            return malformed(id, "slice is null");
        }
        if (slice.getSliceId() == null || slice.getSliceId().isBlank()) {
            return malformed(id, "sliceId is required");
        }
        id = slice.getSliceId();
        if (slice.getRetrievedAt() == null) {
            return malformed(id, "retrievedAt is required");
        }
        if (slice.getWindowFrom() != null && slice.getWindowTo() != null
                && slice.getWindowFrom().isAfter(slice.getWindowTo())) {
            return malformed(id, "windowFrom is after windowTo");
        }
        String seriesProblem = seriesProblem(slice);
        if (seriesProblem != null) {
            return malformed(id, seriesProblem);
        }

        if (slice.getDimensionConstraints() == null) {
            return malformed(id, "dimensionConstraints is required");
        }
        TreeMap<String, String> coordinates = new TreeMap<>();
        TreeMap<String, DimensionConstraint> sorted = new TreeMap<>();
        for (Map.Entry<String, DimensionConstraint> entry : slice.getDimensionConstraints().entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                return malformed(id, "dimension key is blank");
            }
            if (entry.getValue() == null) {
                return malformed(id, "constraint for " + entry.getKey() + " is null");
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, DimensionConstraint> entry : sorted.entrySet()) {
            DimensionConstraint constraint = entry.getValue();
            boolean partitionable = switch (constraint.kind()) {
                case EXACT -> true;
                case ANY_VALUE, CASE_SELECTOR, EXCLUSION -> false;
            };
            if (!partitionable) {
                return Eligibility.excluded(SliceDiagnostic.builder()
                        .sliceId(id)
                        .reason(CoverageReason.NON_PARTITIONABLE_SLICE.code(entry.getKey()))
                        .detail(constraint.kind() + " " + constraint.canonical())
                        .build());
            }
            coordinates.put(entry.getKey(), constraint.canonical());
        }
        return Eligibility.admitted(new AdmittedSlice(slice, signature, coordinates));
    }

    private static String seriesProblem(Slice slice) {
        if (slice.getSeries() == null) {
            return "series is required";
        }
        Set<LocalDate> seen = new HashSet<>();
        for (SeriesPoint point : slice.getSeries()) {
            if (point == null) {
                return "series contains a null point";
            }
            if (point.getDate() == null) {
                return "series point without date";
            }
            if (!seen.add(point.getDate())) {
                return "duplicate series date " + point.getDate();
            }
            if (point.getN() < 0 || point.getK() < 0) {
                return "negative count on " + point.getDate();
            }
            for (Map.Entry<String, Double> metric : point.getMetrics().entrySet()) {
                if (metric.getValue() == null || !Double.isFinite(metric.getValue())) {
                    return "non-finite metric " + metric.getKey() + " on " + point.getDate();
                }
            }
        }
        return null;
    }

    private static Eligibility malformed(String id, String detail) {
        return Eligibility.excluded(SliceDiagnostic.builder()
                .sliceId(id)
                .reason(CoverageReason.MALFORMED_SLICE_SKIPPED.code(null))
                .detail(detail)
                .build());
    }

    /**
     * Eligibility outcome: exactly one of {@code admitted} and {@code diagnostic} is set.
     *
     * @param admitted admitted slice, or {@code null}.
     * @param diagnostic exclusion diagnostic, or {@code null}.
     */
    public record Eligibility(AdmittedSlice admitted, SliceDiagnostic diagnostic) {

        static Eligibility admitted(AdmittedSlice slice) {
            return new Eligibility(slice, null);
        }

        static Eligibility excluded(SliceDiagnostic diagnostic) {
            return new Eligibility(null, diagnostic);
        }

        /**
         * Returns whether the slice was admitted.
         */
        public boolean eligible() {
            return admitted != null;
        }
    }
}
