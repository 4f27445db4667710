package org.Aayush.slicecache.slice;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stage 3: collapses slices sharing {@code (dimensionConstraints, signature, windowFrom,
 * windowTo)} to the freshest one.
 *
 * <p>Ties on {@code retrievedAt} keep the lexicographically smaller slice id so the
 * survivor does not depend on input order.</p>
 */
public final class SliceDeduplicator {

    /**
     * Removes duplicates from admitted slices.
     *
     * @param slices admitted slices.
     * @return survivors in first-seen key order plus removal count.
     */
    public Result dedupe(List<AdmittedSlice> slices) {
        Objects.requireNonNull(slices, "slices");
        Object2ObjectLinkedOpenHashMap<String, AdmittedSlice> byKey = new Object2ObjectLinkedOpenHashMap<>(slices.size());
        int removed = 0;
        for (AdmittedSlice candidate : slices) {
            String key = dedupeKey(candidate);
            AdmittedSlice existing = byKey.get(key);
            if (existing == null) {
                byKey.put(key, candidate);
                continue;
            }
            removed++;
            if (fresher(candidate, existing)) {
                byKey.put(key, candidate);
            }
        }
        return new Result(List.copyOf(new ArrayList<>(byKey.values())), removed);
    }

    static String dedupeKey(AdmittedSlice slice) {
        StringBuilder key = new StringBuilder();
        for (Map.Entry<String, String> coordinate : slice.coordinates().entrySet()) {
            key.append(coordinate.getKey()).append('=').append(coordinate.getValue()).append(';');
        }
        key.append('\u0000').append(slice.signature().serialized());
        key.append('\u0000').append(formatDate(slice.slice().getWindowFrom()));
        key.append('\u0000').append(formatDate(slice.slice().getWindowTo()));
        return key.toString();
    }

    private static boolean fresher(AdmittedSlice candidate, AdmittedSlice existing) {
        int byTime = candidate.retrievedAt().compareTo(existing.retrievedAt());
        if (byTime != 0) {
            return byTime > 0;
        }
        return candidate.sliceId().compareTo(existing.sliceId()) < 0;
    }

    private static String formatDate(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    /**
     * Deduplication output.
     *
     * @param retained surviving slices.
     * @param removed number of dropped duplicates.
     */
    public record Result(List<AdmittedSlice> retained, int removed) {
    }
}
