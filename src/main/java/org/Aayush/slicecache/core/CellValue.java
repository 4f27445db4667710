package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Values of one breakdown cell on one date.
 */
@Value
@Builder
public class CellValue {
    /** Dimension key to value, sorted by key. */
    @Singular
    Map<String, String> coordinates;
    /** Contributing slice id. */
    String sliceId;
    /** Population count. */
    long n;
    /** Converted count. */
    long k;
    /** Additional numeric fields. */
    @Singular
    Map<String, Double> metrics;
}
