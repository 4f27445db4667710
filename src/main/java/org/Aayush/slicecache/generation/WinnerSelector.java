package org.Aayush.slicecache.generation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stage 6: orders satisfying generations for one date; the first is the winner.
 *
 * <p>Ranking, first difference wins:</p>
 * <ol>
 * <li>{@code EXACT} before {@code REDUCTION}.</li>
 * <li>Later recency, where recency is the stalest contributing member.</li>
 * <li>{@code sort(dimensionKeySet).join("|")} ascending.</li>
 * <li>Serialized signature bundle ascending.</li>
 * </ol>
 */
public final class WinnerSelector {
    static final Comparator<DateCandidate> RANKING = Comparator
            .comparingInt((DateCandidate candidate) -> priority(candidate.kind()))
            .thenComparing(DateCandidate::recency, Comparator.reverseOrder())
            .thenComparing(candidate -> candidate.generation().key().keySetLabel())
            .thenComparing(candidate -> candidate.generation().key().signatureBundle());

    /**
     * Ranks candidates for one date, winner first.
     *
     * <p>Later entries are fallbacks for a winner that cannot be aggregated.</p>
     *
     * @param candidates satisfying candidates for the same date.
     * @return candidates in ranking order; empty when there are none.
     */
    public List<DateCandidate> rank(Collection<DateCandidate> candidates) {
        Objects.requireNonNull(candidates, "candidates");
        List<DateCandidate> ranked = new ArrayList<>(candidates);
        ranked.sort(RANKING);
        return ranked;
    }

    private static int priority(CoverageKind kind) {
        return switch (kind) {
            case EXACT -> 0;
            case REDUCTION -> 1;
        };
    }
}
