package org.Aayush.slicecache.core;

/**
 * Deterministic bound on combinations-check work per generation and date.
 *
 * <p>Completeness itself is decided by counting distinct cells; the bound only limits the
 * enumeration that locates the first absent combination for diagnostics.</p>
 */
public final class ResolutionBudget {
    public static final int DEFAULT_MAX_COMBINATION_PROBES = 10_000;

    static final String PROP_MAX_COMBINATION_PROBES = "slicecache.coverage.maxCombinationProbes";

    private final int maxCombinationProbes;

    private ResolutionBudget(int maxCombinationProbes) {
        this.maxCombinationProbes = normalizeBound(maxCombinationProbes);
    }

    /**
     * Creates a budget with an explicit probe bound; non-positive values select the default.
     */
    public static ResolutionBudget of(int maxCombinationProbes) {
        return new ResolutionBudget(maxCombinationProbes);
    }

    /**
     * Loads the budget from system properties, falling back to defaults.
     */
    public static ResolutionBudget defaults() {
        return ResolutionBudget.of(readBound(PROP_MAX_COMBINATION_PROBES));
    }

    /**
     * Returns maximum combinations probed while locating a missing one.
     */
    public int maxCombinationProbes() {
        return maxCombinationProbes;
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return DEFAULT_MAX_COMBINATION_PROBES;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_COMBINATION_PROBES;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_COMBINATION_PROBES;
        }
    }

    @Override
    public String toString() {
        return "ResolutionBudget{maxCombinationProbes=" + maxCombinationProbes + "}";
    }
}
