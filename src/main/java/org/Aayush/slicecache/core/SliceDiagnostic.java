package org.Aayush.slicecache.core;

import lombok.Builder;
import lombok.Value;

/**
 * Why one input slice was excluded before grouping.
 */
@Value
@Builder
public class SliceDiagnostic {
    /** Slice id, or a positional label when the slice carried none. */
    String sliceId;
    /** Stable reason code, for example {@code malformed_slice_skipped}. */
    String reason;
    /** Human-readable detail such as the failing field. */
    String detail;
}
