package org.Aayush.slicecache.generation;

import org.Aayush.slicecache.slice.AdmittedSlice;
import org.Aayush.slicecache.slice.SeriesPoint;

import java.util.Objects;

/**
 * One slice's observation used for one cell of a generation on one date.
 *
 * @param slice contributing slice.
 * @param point observation on the date.
 */
public record Contribution(AdmittedSlice slice, SeriesPoint point) {
    public Contribution {
        Objects.requireNonNull(slice, "slice");
        Objects.requireNonNull(point, "point");
    }
}
