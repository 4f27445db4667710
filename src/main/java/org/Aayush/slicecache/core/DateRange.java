package org.Aayush.slicecache.core;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range.
 *
 * @param from first date.
 * @param to last date.
 */
public record DateRange(LocalDate from, LocalDate to) {
    public DateRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("range end precedes start: " + from + " > " + to);
        }
    }
}
