package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one resolution call.
 *
 * <p>{@code values} and {@code uncoveredDates} partition the requested dates; both follow
 * the query's date order. {@code fullyCovered} is true exactly when
 * {@code uncoveredDates} is empty.</p>
 */
@Value
@Builder
public class CoverageResult {
    /** Whether every requested date was answered from cache. */
    boolean fullyCovered;
    /** Aggregated values per covered date. */
    @Singular
    List<DateValue> values;
    /** Dates that need retrieval, with reasons. */
    @Singular
    List<UncoveredDate> uncoveredDates;
    /** Winning generation per covered date. */
    @Singular("traceEntry")
    List<SelectionTraceEntry> selectionTrace;
    /** Slices excluded before grouping. */
    @Singular
    List<SliceDiagnostic> sliceDiagnostics;
    /** Number of duplicate slices dropped by the deduplicator. */
    int duplicatesRemoved;
}
