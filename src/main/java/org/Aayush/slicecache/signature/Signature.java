package org.Aayush.slicecache.signature;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Semantic identity of a slice or query.
 *
 * <p>{@code coreHash} identifies the event/connection/latency definition and
 * {@code contextHashes} the taxonomy version of each dimension. Hash values may be the
 * {@link #HASH_MISSING} or {@link #HASH_ERROR} sentinels, which never match anything.</p>
 *
 * @param coreHash semantic core hash.
 * @param contextHashes dimension key to taxonomy hash, sorted by key.
 */
public record Signature(String coreHash, SortedMap<String, String> contextHashes) {
    public static final String HASH_MISSING = "missing";
    public static final String HASH_ERROR = "error";

    public Signature {
        Objects.requireNonNull(coreHash, "coreHash");
        TreeMap<String, String> copy = new TreeMap<>();
        if (contextHashes != null) {
            for (Map.Entry<String, String> entry : contextHashes.entrySet()) {
                copy.put(
                        Objects.requireNonNull(entry.getKey(), "contextHashes.key"),
                        Objects.requireNonNull(entry.getValue(), "contextHashes.value")
                );
            }
        }
        contextHashes = Collections.unmodifiableSortedMap(copy);
    }

    /**
     * Creates a signature from an arbitrary context-hash map.
     */
    public static Signature of(String coreHash, Map<String, String> contextHashes) {
        return new Signature(coreHash, contextHashes == null ? null : new TreeMap<>(contextHashes));
    }

    /**
     * Creates an uncontexted signature.
     */
    public static Signature of(String coreHash) {
        return new Signature(coreHash, null);
    }

    /**
     * Returns hash for one dimension, or {@code null} when not carried.
     */
    public String contextHash(String dimensionKey) {
        return contextHashes.get(dimensionKey);
    }

    /**
     * Returns a copy keeping only context hashes of the given dimensions.
     */
    public Signature restrictTo(Collection<String> dimensionKeys) {
        TreeMap<String, String> restricted = new TreeMap<>();
        for (String key : dimensionKeys) {
            String hash = contextHashes.get(key);
            if (hash != null) {
                restricted.put(key, hash);
            }
        }
        return new Signature(coreHash, restricted);
    }

    /**
     * Returns the canonical serialized form.
     */
    public String serialized() {
        return SignatureCodec.serialize(this);
    }

    /**
     * Returns whether a hash value is one of the unavailable sentinels.
     */
    public static boolean isSentinel(String hash) {
        return HASH_MISSING.equals(hash) || HASH_ERROR.equals(hash);
    }
}
