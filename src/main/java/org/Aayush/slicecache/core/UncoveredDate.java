package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * A requested date the cache cannot answer, with the most specific reason observed.
 */
@Value
@Builder
public class UncoveredDate {
    LocalDate date;
    /** Stable reason code from {@link CoverageReason}. */
    String reason;
    /** Sorted diagnostic attributes; empty for plain gaps. */
    Map<String, String> detail;
}
