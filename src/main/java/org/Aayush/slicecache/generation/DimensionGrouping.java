package org.Aayush.slicecache.generation;

import org.Aayush.slicecache.signature.Signature;
import org.Aayush.slicecache.slice.AdmittedSlice;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Stage 4: partitions admitted slices into generations.
 *
 * <p>Slices are grouped by exact dimension key set, then split by the signature bundle
 * relevant to that key set, so data collected under different taxonomy versions never
 * forms one apparently complete partition. Output is sorted by {@link GenerationKey}.</p>
 */
public final class DimensionGrouping {

    /**
     * Groups deduplicated, eligible slices.
     *
     * @param slices admitted slices.
     * @return generations sorted by key.
     */
    public List<Generation> group(List<AdmittedSlice> slices) {
        Objects.requireNonNull(slices, "slices");
        TreeMap<GenerationKey, List<AdmittedSlice>> membersByKey = new TreeMap<>();
        TreeMap<GenerationKey, Signature> bundleByKey = new TreeMap<>();
        for (AdmittedSlice slice : slices) {
            List<String> keys = new ArrayList<>(slice.dimensionKeySet());
            Signature bundle = slice.signature().restrictTo(keys);
            GenerationKey key = new GenerationKey(keys, bundle.serialized());
            membersByKey.computeIfAbsent(key, ignored -> new ArrayList<>()).add(slice);
            bundleByKey.putIfAbsent(key, bundle);
        }

        List<Generation> generations = new ArrayList<>(membersByKey.size());
        for (Map.Entry<GenerationKey, List<AdmittedSlice>> entry : membersByKey.entrySet()) {
            generations.add(new Generation(entry.getKey(), bundleByKey.get(entry.getKey()), entry.getValue()));
        }
        return List.copyOf(generations);
    }
}
