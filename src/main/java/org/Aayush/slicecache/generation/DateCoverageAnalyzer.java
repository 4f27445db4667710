package org.Aayush.slicecache.generation;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.slicecache.context.ContextDefinitions;
import org.Aayush.slicecache.context.OtherPolicy;
import org.Aayush.slicecache.core.CoverageFailure;
import org.Aayush.slicecache.core.CoverageReason;
import org.Aayush.slicecache.core.ResolutionBudget;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Stage 5: decides whether one generation fully satisfies one date.
 *
 * <p>Evaluation order for a generation with data on the date:</p>
 * <ul>
 * <li>Applicability: key set equal to the breakdown is {@code EXACT}; any non-empty key
 * set under an empty breakdown is {@code REDUCTION}; a key set lacking a requested
 * dimension fails with {@code group_missing_query_dimension:<key>}; supersets of a
 * non-empty breakdown are not evaluated.</li>
 * <li>Reducibility: a reduction over a dimension whose {@link OtherPolicy} declares its
 * values non-MECE fails with {@code dimension_not_mece:<key>}.</li>
 * <li>Per-dimension MECE: distinct values present must equal the expected value set
 * under the dimension's {@link OtherPolicy}.</li>
 * <li>Combinations: distinct cells must equal the product of defined value-set sizes.
 * With per-dimension sets already exact, equal counts imply the full Cartesian product.
 * On a shortfall the first absent combination is located by a short-circuiting
 * enumeration bounded by {@link ResolutionBudget#maxCombinationProbes()}.</li>
 * </ul>
 */
@Slf4j
public final class DateCoverageAnalyzer {
    private final ResolutionBudget budget;

    /**
     * Creates an analyzer bound to one work budget.
     */
    public DateCoverageAnalyzer(ResolutionBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Assesses one generation/date pair.
     *
     * @param generation generation under test.
     * @param date requested date.
     * @param breakdownDimensions requested breakdown (empty for one aggregated total).
     * @param definitions live context definitions.
     * @return candidate, failure, or {@link Assessment#NOT_APPLICABLE}.
     */
    public Assessment assess(
            Generation generation,
            LocalDate date,
            Set<String> breakdownDimensions,
            ContextDefinitions definitions
    ) {
        Objects.requireNonNull(generation, "generation");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(breakdownDimensions, "breakdownDimensions");
        Objects.requireNonNull(definitions, "definitions");

        SortedMap<String, Contribution> cells = generation.cellsOn(date);
        if (cells.isEmpty()) {
            return Assessment.NOT_APPLICABLE;
        }

        List<String> keys = generation.dimensionKeys();
        CoverageKind kind;
        if (breakdownDimensions.isEmpty()) {
            kind = keys.isEmpty() ? CoverageKind.EXACT : CoverageKind.REDUCTION;
        } else {
            for (String required : new TreeSet<>(breakdownDimensions)) {
                if (!keys.contains(required)) {
                    return Assessment.failed(CoverageFailure.forDimension(
                            CoverageReason.GROUP_MISSING_QUERY_DIMENSION,
                            required,
                            Map.of("generation", generation.key().keySetLabel())
                    ));
                }
            }
            if (keys.size() != breakdownDimensions.size()) {
                return Assessment.NOT_APPLICABLE;
            }
            kind = CoverageKind.EXACT;
        }

        if (kind == CoverageKind.REDUCTION) {
            CoverageFailure policyFailure = checkReducible(generation, keys, definitions);
            if (policyFailure != null) {
                return Assessment.failed(policyFailure);
            }
        }

        CoverageFailure meceFailure = checkMece(generation, keys, cells.values(), definitions);
        if (meceFailure != null) {
            return Assessment.failed(meceFailure);
        }

        CoverageFailure combinationsFailure = checkCombinations(generation, keys, cells, definitions);
        if (combinationsFailure != null) {
            return Assessment.failed(combinationsFailure);
        }

        List<Contribution> contributions = new ArrayList<>(cells.values());
        return Assessment.satisfied(new DateCandidate(
                generation,
                kind,
                date,
                contributions,
                DateCandidate.stalestMember(contributions)
        ));
    }

    private static CoverageFailure checkReducible(Generation generation, List<String> keys, ContextDefinitions definitions) {
        for (String key : keys) {
            OtherPolicy policy = definitions.otherPolicy(key);
            if (policy != null && !policy.reducible()) {
                return CoverageFailure.forDimension(
                        CoverageReason.DIMENSION_NOT_MECE,
                        key,
                        Map.of("generation", generation.key().keySetLabel(), "otherPolicy", policy.id())
                );
            }
        }
        return null;
    }

    private static CoverageFailure checkMece(
            Generation generation,
            List<String> keys,
            Collection<Contribution> cells,
            ContextDefinitions definitions
    ) {
        for (String key : keys) {
            Set<String> expected = definitions.expectedValues(key);
            if (expected == null) {
                return CoverageFailure.forDimension(
                        CoverageReason.DIMENSION_NOT_MECE,
                        key,
                        Map.of("generation", generation.key().keySetLabel(), "definition", "absent")
                );
            }
            TreeSet<String> present = new TreeSet<>();
            for (Contribution cell : cells) {
                present.add(cell.slice().coordinates().get(key));
            }
            if (!present.equals(expected)) {
                TreeSet<String> missing = new TreeSet<>(expected);
                missing.removeAll(present);
                TreeSet<String> unexpected = new TreeSet<>(present);
                unexpected.removeAll(expected);
                TreeMap<String, String> detail = new TreeMap<>();
                detail.put("generation", generation.key().keySetLabel());
                detail.put("missing", String.join(",", missing));
                detail.put("unexpected", String.join(",", unexpected));
                return CoverageFailure.forDimension(CoverageReason.DIMENSION_NOT_MECE, key, detail);
            }
        }
        return null;
    }

    private CoverageFailure checkCombinations(
            Generation generation,
            List<String> keys,
            SortedMap<String, Contribution> cells,
            ContextDefinitions definitions
    ) {
        long expected = 1L;
        for (String key : keys) {
            expected = saturatingMultiply(expected, definitions.expectedValues(key).size());
        }
        if (cells.size() == expected) {
            return null;
        }

        TreeMap<String, String> detail = new TreeMap<>();
        detail.put("generation", generation.key().keySetLabel());
        detail.put("present", Integer.toString(cells.size()));
        detail.put("expected", expected == Long.MAX_VALUE ? "overflow" : Long.toString(expected));
        String firstMissing = findFirstMissing(keys, cells.keySet(), definitions);
        if (firstMissing != null) {
            detail.put("firstMissing", firstMissing);
        } else {
            detail.put("probeBudgetExhausted", "true");
            log.warn(
                    "combination probe budget of {} exhausted for generation {} before locating a missing combination",
                    budget.maxCombinationProbes(),
                    generation.key()
            );
        }
        return CoverageFailure.of(CoverageReason.MISSING_COMBINATIONS, detail);
    }

    /**
     * Walks the Cartesian product in sorted odometer order and returns the first absent
     * cell label, or {@code null} when the probe budget runs out first.
     */
    private String findFirstMissing(List<String> keys, Set<String> presentCells, ContextDefinitions definitions) {
        ObjectOpenHashSet<String> present = new ObjectOpenHashSet<>(presentCells);
        List<List<String>> axes = new ArrayList<>(keys.size());
        for (String key : keys) {
            axes.add(new ArrayList<>(new TreeSet<>(definitions.expectedValues(key))));
        }
        int[] odometer = new int[keys.size()];
        int probes = 0;
        while (probes < budget.maxCombinationProbes()) {
            probes++;
            StringJoiner label = new StringJoiner("|");
            for (int i = 0; i < keys.size(); i++) {
                label.add(keys.get(i) + ":" + axes.get(i).get(odometer[i]));
            }
            String cell = label.toString();
            if (!present.contains(cell)) {
                return cell;
            }
            if (!advance(odometer, axes)) {
                return null;
            }
        }
        return null;
    }

    private static boolean advance(int[] odometer, List<List<String>> axes) {
        for (int i = odometer.length - 1; i >= 0; i--) {
            odometer[i]++;
            if (odometer[i] < axes.get(i).size()) {
                return true;
            }
            odometer[i] = 0;
        }
        return false;
    }

    private static long saturatingMultiply(long left, long right) {
        try {
            return Math.multiplyExact(left, right);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Outcome for one generation/date pair: a candidate, a failure, or neither.
     *
     * @param candidate satisfying candidate, or {@code null}.
     * @param failure observed failure, or {@code null}.
     */
    public record Assessment(DateCandidate candidate, CoverageFailure failure) {
        public static final Assessment NOT_APPLICABLE = new Assessment(null, null);

        static Assessment satisfied(DateCandidate candidate) {
            return new Assessment(Objects.requireNonNull(candidate, "candidate"), null);
        }

        static Assessment failed(CoverageFailure failure) {
            return new Assessment(null, Objects.requireNonNull(failure, "failure"));
        }

        public boolean satisfied() {
            return candidate != null;
        }
    }
}
