package org.Aayush.slicecache.generation;

import org.Aayush.slicecache.signature.Signature;
import org.Aayush.slicecache.slice.AdmittedSlice;
import org.Aayush.slicecache.slice.SeriesPoint;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Ephemeral group of slices sharing one dimension key set and one relevant signature
 * bundle. Built fresh on every resolution call.
 */
public final class Generation {
    private final GenerationKey key;
    private final Signature bundle;
    private final List<AdmittedSlice> members;

    Generation(GenerationKey key, Signature bundle, List<AdmittedSlice> members) {
        this.key = Objects.requireNonNull(key, "key");
        this.bundle = Objects.requireNonNull(bundle, "bundle");
        this.members = List.copyOf(members);
    }

    public GenerationKey key() {
        return key;
    }

    /**
     * Returns the signature restricted to this generation's dimensions.
     */
    public Signature bundle() {
        return bundle;
    }

    public List<AdmittedSlice> members() {
        return members;
    }

    /**
     * Returns the sorted dimension keys.
     */
    public List<String> dimensionKeys() {
        return key.dimensionKeys();
    }

    /**
     * Returns the contributing observation per cell on one date, keyed by cell label.
     *
     * <p>When two members cover the same cell (same coordinates, different windows), the
     * freshest one is used; equal timestamps keep the smaller slice id.</p>
     */
    public SortedMap<String, Contribution> cellsOn(LocalDate date) {
        TreeMap<String, Contribution> cells = new TreeMap<>();
        for (AdmittedSlice member : members) {
            SeriesPoint point = member.pointOn(date);
            if (point == null) {
                continue;
            }
            String cellKey = member.cellKey();
            Contribution existing = cells.get(cellKey);
            if (existing == null || preferred(member, existing.slice())) {
                cells.put(cellKey, new Contribution(member, point));
            }
        }
        return Collections.unmodifiableSortedMap(cells);
    }

    private static boolean preferred(AdmittedSlice candidate, AdmittedSlice existing) {
        int byTime = candidate.retrievedAt().compareTo(existing.retrievedAt());
        if (byTime != 0) {
            return byTime > 0;
        }
        return candidate.sliceId().compareTo(existing.sliceId()) < 0;
    }

    @Override
    public String toString() {
        return "Generation" + key + "[" + members.size() + " slices]";
    }
}
