package org.Aayush.slicecache.generation;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A generation that fully satisfies one date.
 *
 * @param generation satisfying generation.
 * @param kind exact or reduction.
 * @param date satisfied date.
 * @param contributions one contribution per cell, sorted by cell label.
 * @param recency minimum {@code retrievedAt} over the contributing slices.
 */
public record DateCandidate(
        Generation generation,
        CoverageKind kind,
        LocalDate date,
        List<Contribution> contributions,
        Instant recency
) {
    public DateCandidate {
        Objects.requireNonNull(generation, "generation");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(date, "date");
        contributions = List.copyOf(contributions);
        if (contributions.isEmpty()) {
            throw new IllegalArgumentException("candidate requires at least one contribution");
        }
        Objects.requireNonNull(recency, "recency");
    }

    /**
     * Computes stalest-member recency over contributions.
     */
    static Instant stalestMember(List<Contribution> contributions) {
        Instant min = null;
        for (Contribution contribution : contributions) {
            Instant retrievedAt = contribution.slice().retrievedAt();
            if (min == null || retrievedAt.isBefore(min)) {
                min = retrievedAt;
            }
        }
        return min;
    }
}
