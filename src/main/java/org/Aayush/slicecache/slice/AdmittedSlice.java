package org.Aayush.slicecache.slice;

import org.Aayush.slicecache.signature.Signature;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A slice that passed signature and eligibility checks, with its parsed signature and
 * exact coordinates resolved once.
 */
public final class AdmittedSlice {
    private final Slice slice;
    private final Signature signature;
    private final SortedMap<String, String> coordinates;
    private final Map<LocalDate, SeriesPoint> pointsByDate;

    AdmittedSlice(Slice slice, Signature signature, SortedMap<String, String> coordinates) {
        this.slice = Objects.requireNonNull(slice, "slice");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.coordinates = Collections.unmodifiableSortedMap(new TreeMap<>(coordinates));
        HashMap<LocalDate, SeriesPoint> points = new HashMap<>();
        for (SeriesPoint point : slice.getSeries()) {
            points.put(point.getDate(), point);
        }
        this.pointsByDate = Collections.unmodifiableMap(points);
    }

    /**
     * Returns the underlying caller-owned slice.
     */
    public Slice slice() {
        return slice;
    }

    /**
     * Returns the parsed signature.
     */
    public Signature signature() {
        return signature;
    }

    /**
     * Returns dimension key to exact value, sorted by key.
     */
    public SortedMap<String, String> coordinates() {
        return coordinates;
    }

    /**
     * Returns the dimension key set this slice is partitioned by.
     */
    public SortedSet<String> dimensionKeySet() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(coordinates.keySet()));
    }

    /**
     * Returns canonical {@code key:value|key:value} cell label; empty when uncontexted.
     */
    public String cellKey() {
        StringJoiner joiner = new StringJoiner("|");
        for (Map.Entry<String, String> entry : coordinates.entrySet()) {
            joiner.add(entry.getKey() + ":" + entry.getValue());
        }
        return joiner.toString();
    }

    /**
     * Returns this slice's observation on one date, or {@code null}.
     */
    public SeriesPoint pointOn(LocalDate date) {
        return pointsByDate.get(date);
    }

    public String sliceId() {
        return slice.getSliceId();
    }

    public Instant retrievedAt() {
        return slice.getRetrievedAt();
    }

    @Override
    public String toString() {
        return "AdmittedSlice{" + sliceId() + ", " + cellKey() + "}";
    }
}
