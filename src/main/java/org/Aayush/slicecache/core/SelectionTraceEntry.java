package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.slicecache.generation.CoverageKind;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Which generation answered one covered date. Intended for logs and assertions.
 */
@Value
@Builder
public class SelectionTraceEntry {
    LocalDate date;
    /** Sorted dimension keys of the winning generation. */
    @Singular
    List<String> dimensionKeys;
    /** Exact or reduction. */
    CoverageKind kind;
    /** Serialized signature bundle of the winning generation. */
    String signature;
    /** Stalest contributing {@code retrievedAt}. */
    Instant recency;
    /** Contributing slice ids, sorted. */
    @Singular
    List<String> contributingSliceIds;
}
