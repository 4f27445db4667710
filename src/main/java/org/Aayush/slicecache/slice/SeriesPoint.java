package org.Aayush.slicecache.slice;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * One daily observation inside a slice series.
 */
@Value
@Builder
public class SeriesPoint {
    /** Observation date. */
    LocalDate date;
    /** Population count. */
    long n;
    /** Converted count. */
    long k;
    /** Additional additive numeric fields keyed by name. */
    @Singular
    Map<String, Double> metrics;
}
