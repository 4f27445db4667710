package org.Aayush.slicecache.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Closed taxonomy of data-quality reasons reported by coverage resolution.
 *
 * <p>{@code specificity} orders reasons when several failures were observed for one
 * date: the higher value is reported. Analyzer failures describe data that nearly
 * satisfied the query and outrank signature rejections, which outrank a plain gap.
 * {@code aggregate_overflow} is reported only for generations that satisfied the date
 * but whose count totals do not fit in a {@code long}.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum CoverageReason {
    GAP_IN_COVERAGE("gap_in_coverage", false, 0),
    MALFORMED_SLICE_SKIPPED("malformed_slice_skipped", false, 0),
    NON_PARTITIONABLE_SLICE("non_partitionable_slice", true, 0),
    SIGNATURE_CORE_HASH_MISMATCH("signature_incompatible:core_hash_mismatch", false, 10),
    CONTEXT_HASH_UNAVAILABLE("context_hash_unavailable", true, 20),
    CONTEXT_DEFINITION_CHANGED("context_definition_changed", false, 30),
    GROUP_MISSING_QUERY_DIMENSION("group_missing_query_dimension", true, 40),
    DIMENSION_NOT_MECE("dimension_not_mece", true, 50),
    MISSING_COMBINATIONS("missing_combinations", false, 60),
    AGGREGATE_OVERFLOW("aggregate_overflow", false, 70);

    /** Stable wire prefix. */
    private final String prefix;
    /** True when the reported code carries a {@code :<dimension>} suffix. */
    private final boolean dimensional;
    /** Rank used to pick the most specific failure for a date. */
    private final int specificity;

    /**
     * Renders the wire code, appending the dimension for dimensional reasons.
     *
     * @param dimension dimension key (ignored for non-dimensional reasons).
     * @return stable reason code.
     */
    public String code(String dimension) {
        if (!dimensional) {
            return prefix;
        }
        if (dimension == null || dimension.isBlank()) {
            throw new IllegalArgumentException("dimension is required for reason " + name());
        }
        return prefix + ":" + dimension;
    }
}
