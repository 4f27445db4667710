package org.Aayush.slicecache.core;

import lombok.experimental.UtilityClass;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Collapses uncovered dates into contiguous inclusive ranges for a fetch planner.
 */
@UtilityClass
public class UncoveredRanges {

    /**
     * Returns ascending, non-overlapping ranges covering exactly the uncovered dates.
     */
    public List<DateRange> coalesce(CoverageResult result) {
        Objects.requireNonNull(result, "result");
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (UncoveredDate uncovered : result.getUncoveredDates()) {
            dates.add(uncovered.getDate());
        }
        List<DateRange> ranges = new ArrayList<>();
        LocalDate start = null;
        LocalDate end = null;
        for (LocalDate date : dates) {
            if (start == null) {
                start = date;
                end = date;
            } else if (date.equals(end.plusDays(1))) {
                end = date;
            } else {
                ranges.add(new DateRange(start, end));
                start = date;
                end = date;
            }
        }
        if (start != null) {
            ranges.add(new DateRange(start, end));
        }
        return List.copyOf(ranges);
    }
}
