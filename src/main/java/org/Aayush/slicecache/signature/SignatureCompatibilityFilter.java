package org.Aayush.slicecache.signature;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Stage 1 filter: decides whether a slice's signature means the same thing as the query's.
 *
 * <p>Rules, evaluated in order:</p>
 * <ul>
 * <li>Core hashes differ: {@code signature_incompatible:core_hash_mismatch}.</li>
 * <li>For each relevant dimension carried by either side (sorted by key): a
 * {@code "missing"}/{@code "error"} sentinel on either side is
 * {@code context_hash_unavailable:<key>}; a query hash the slice lacks, or two differing
 * hashes, is {@code context_definition_changed}.</li>
 * <li>A slice hash for a dimension the query does not pin is accepted; its completeness is
 * validated later against the live context definitions.</li>
 * </ul>
 */
public final class SignatureCompatibilityFilter {

    /**
     * Compares one slice signature with the query signature.
     *
     * @param sliceSignature parsed slice signature.
     * @param querySignature live query signature.
     * @param relevantKeys dimension keys relevant to this slice/query pair.
     * @return compatibility verdict; never throws for data problems.
     */
    public CompatibilityVerdict check(
            Signature sliceSignature,
            Signature querySignature,
            Collection<String> relevantKeys
    ) {
        Signature slice = Objects.requireNonNull(sliceSignature, "sliceSignature");
        Signature query = Objects.requireNonNull(querySignature, "querySignature");

        if (!slice.coreHash().equals(query.coreHash())) {
            return CompatibilityVerdict.coreHashMismatch();
        }

        TreeSet<String> keys = new TreeSet<>(Objects.requireNonNull(relevantKeys, "relevantKeys"));
        for (String key : keys) {
            String queryHash = query.contextHash(key);
            String sliceHash = slice.contextHash(key);
            if (queryHash == null && sliceHash == null) {
                continue;
            }
            if (Signature.isSentinel(queryHash) || Signature.isSentinel(sliceHash)) {
                return CompatibilityVerdict.hashUnavailable(key);
            }
            if (queryHash == null) {
                continue;
            }
            if (!queryHash.equals(sliceHash)) {
                return CompatibilityVerdict.definitionChanged(key);
            }
        }
        return CompatibilityVerdict.COMPATIBLE;
    }
}
