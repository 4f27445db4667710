package org.Aayush.slicecache.generation;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Identity of one generation: sorted dimension key set plus the serialized relevant
 * signature bundle (core hash and the context hashes of those dimensions).
 *
 * @param dimensionKeys sorted dimension keys; empty for uncontexted data.
 * @param signatureBundle canonical serialized signature restricted to {@code dimensionKeys}.
 */
public record GenerationKey(List<String> dimensionKeys, String signatureBundle) implements Comparable<GenerationKey> {
    private static final Comparator<GenerationKey> ORDER = Comparator
            .comparing(GenerationKey::keySetLabel)
            .thenComparing(GenerationKey::signatureBundle);

    public GenerationKey {
        dimensionKeys = List.copyOf(Objects.requireNonNull(dimensionKeys, "dimensionKeys").stream().sorted().toList());
        Objects.requireNonNull(signatureBundle, "signatureBundle");
    }

    /**
     * Returns {@code sort(dimensionKeySet).join("|")}.
     */
    public String keySetLabel() {
        return String.join("|", dimensionKeys);
    }

    @Override
    public int compareTo(GenerationKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "{" + keySetLabel() + "}#" + signatureBundle;
    }
}
