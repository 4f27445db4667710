package org.Aayush.slicecache.core;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One observed reason why a date could not be answered from a slice or generation.
 *
 * @param reason taxonomy entry.
 * @param dimension dimension key for dimensional reasons, otherwise {@code null}.
 * @param detail sorted diagnostic attributes.
 */
public record CoverageFailure(CoverageReason reason, String dimension, SortedMap<String, String> detail) {

    /**
     * Orders failures from most to least specific with a deterministic tail.
     */
    public static final Comparator<CoverageFailure> MOST_SPECIFIC_FIRST = Comparator
            .comparingInt((CoverageFailure failure) -> failure.reason().specificity())
            .reversed()
            .thenComparing(CoverageFailure::code)
            .thenComparing(failure -> failure.detail().toString());

    public CoverageFailure {
        Objects.requireNonNull(reason, "reason");
        detail = detail == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(detail));
        if (reason.dimensional()) {
            reason.code(dimension);
        }
    }

    /**
     * Creates a failure without a dimension suffix.
     */
    public static CoverageFailure of(CoverageReason reason, Map<String, String> detail) {
        return new CoverageFailure(reason, null, detail == null ? null : new TreeMap<>(detail));
    }

    /**
     * Creates a failure scoped to one dimension key.
     */
    public static CoverageFailure forDimension(CoverageReason reason, String dimension, Map<String, String> detail) {
        return new CoverageFailure(reason, dimension, detail == null ? null : new TreeMap<>(detail));
    }

    /**
     * Returns the stable wire code of this failure.
     */
    public String code() {
        return reason.code(dimension);
    }
}
