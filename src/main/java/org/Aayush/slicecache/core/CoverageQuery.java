package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.slicecache.signature.Signature;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Structured coverage query produced by the caller's DSL layer.
 */
@Value
@Builder
public class CoverageQuery {
    /** Requested dates in caller order; duplicates are collapsed. */
    @Singular
    List<LocalDate> dates;
    /** Live semantic signature. */
    Signature signature;
    /** Requested breakdown; empty asks for one aggregated total per date. */
    @Singular
    Set<String> breakdownDimensions;
}
