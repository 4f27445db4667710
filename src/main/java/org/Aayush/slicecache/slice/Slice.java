package org.Aayush.slicecache.slice;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One retrieved dataset scoped by a (possibly empty) set of dimension constraints.
 *
 * <p>Slices are owned by the caller's storage layer. The resolver only reads them and
 * tolerates partially populated instances: missing fields make a slice ineligible rather
 * than failing the call.</p>
 */
@Value
@Builder(toBuilder = true)
public class Slice {
    /** Stable identifier reported in selection traces and diagnostics. */
    String sliceId;
    /** Dimension key to constraint; empty for uncontexted data. */
    @Singular
    Map<String, DimensionConstraint> dimensionConstraints;
    /** Serialized signature text. */
    String signature;
    /** Date-unique daily observations. */
    @Singular("point")
    List<SeriesPoint> series;
    /** Retrieval timestamp. */
    Instant retrievedAt;
    /** Optional retrieval window start. */
    LocalDate windowFrom;
    /** Optional retrieval window end. */
    LocalDate windowTo;
}
