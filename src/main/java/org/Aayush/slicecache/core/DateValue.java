package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Aggregated values for one covered date.
 *
 * <p>{@code cells} is populated only for exact answers to a non-empty breakdown.</p>
 */
@Value
@Builder
public class DateValue {
    LocalDate date;
    /** Sum of {@code n} over the winning generation's contributing slices. */
    long n;
    /** Sum of {@code k} over the winning generation's contributing slices. */
    long k;
    /** Sums of extra numeric fields carried by every contributing point. */
    @Singular
    Map<String, Double> metrics;
    /** Per-cell values for breakdown answers. */
    @Singular
    List<CellValue> cells;
}
