package org.Aayush.slicecache.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable live taxonomy: dimension key to the ordered set of valid value ids and the
 * dimension's {@link OtherPolicy}.
 *
 * <p>The resolver treats the expected value sets as ground truth for MECE and
 * Cartesian-product checks and never infers them from slices. Ids are compared exactly as
 * given, the same way slice coordinates are.</p>
 */
public final class ContextDefinitions {
    /** Catch-all value id. */
    public static final String OTHER = "other";

    private static final ContextDefinitions EMPTY = new ContextDefinitions(Map.of());

    private final Map<String, Dimension> dimensionsByKey;

    private ContextDefinitions(Map<String, Declared> declarations) {
        LinkedHashMap<String, Dimension> dimensions = new LinkedHashMap<>();
        for (Map.Entry<String, Declared> entry : declarations.entrySet()) {
            String key = requireId(entry.getKey(), "dimension key");
            Declared declared = entry.getValue();
            OtherPolicy policy = Objects.requireNonNull(declared.policy(), "otherPolicy for " + key);
            Collection<String> rawValues = Objects.requireNonNull(declared.values(), "values for " + key);
            if (rawValues.isEmpty()) {
                throw new IllegalArgumentException("dimension " + key + " must define at least one value");
            }
            LinkedHashSet<String> expected = new LinkedHashSet<>();
            for (String value : rawValues) {
                String id = requireId(value, "value of " + key);
                if (!expected.add(id)) {
                    throw new IllegalArgumentException("duplicate value " + id + " for dimension " + key);
                }
            }
            switch (policy) {
                case NULL, UNDEFINED -> expected.remove(OTHER);
                case COMPUTED -> expected.add(OTHER);
                case EXPLICIT -> {
                }
            }
            if (expected.isEmpty()) {
                throw new IllegalArgumentException(
                        "dimension " + key + " has no expected values under otherPolicy " + policy.id()
                );
            }
            dimensions.put(key, new Dimension(policy, Collections.unmodifiableSet(expected)));
        }
        this.dimensionsByKey = Collections.unmodifiableMap(dimensions);
    }

    /**
     * Creates definitions from a key to values mapping, every dimension {@link OtherPolicy#EXPLICIT}.
     *
     * @throws IllegalArgumentException on blank keys, blank or duplicate values, or empty value lists.
     */
    public static ContextDefinitions of(Map<String, ? extends Collection<String>> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        LinkedHashMap<String, Declared> declarations = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : definitions.entrySet()) {
            declarations.put(entry.getKey(), new Declared(OtherPolicy.EXPLICIT, entry.getValue()));
        }
        return new ContextDefinitions(declarations);
    }

    /**
     * Returns definitions with no dimensions.
     */
    public static ContextDefinitions empty() {
        return EMPTY;
    }

    /**
     * Starts a fluent builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns whether a dimension is defined.
     */
    public boolean defines(String dimensionKey) {
        return dimensionKey != null && dimensionsByKey.containsKey(dimensionKey);
    }

    /**
     * Returns the values a complete partition of one dimension must contain, in definition
     * order, or {@code null} when not defined.
     *
     * <p>{@code other} is dropped under {@link OtherPolicy#NULL} and {@link OtherPolicy#UNDEFINED}
     * and appended under {@link OtherPolicy#COMPUTED} when not listed.</p>
     */
    public Set<String> expectedValues(String dimensionKey) {
        Dimension dimension = dimensionKey == null ? null : dimensionsByKey.get(dimensionKey);
        return dimension == null ? null : dimension.expected();
    }

    /**
     * Returns the policy of one dimension, or {@code null} when not defined.
     */
    public OtherPolicy otherPolicy(String dimensionKey) {
        Dimension dimension = dimensionKey == null ? null : dimensionsByKey.get(dimensionKey);
        return dimension == null ? null : dimension.policy();
    }

    /**
     * Returns the defined dimension keys in definition order.
     */
    public Set<String> dimensionKeys() {
        return dimensionsByKey.keySet();
    }

    private static String requireId(String id, String fieldName) {
        Objects.requireNonNull(id, fieldName);
        if (id.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must be non-blank");
        }
        return id;
    }

    private record Declared(OtherPolicy policy, Collection<String> values) {
    }

    private record Dimension(OtherPolicy policy, Set<String> expected) {
    }

    /**
     * Fluent builder for {@link ContextDefinitions}.
     */
    public static final class Builder {
        private final LinkedHashMap<String, Declared> definitions = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Adds or replaces one {@link OtherPolicy#EXPLICIT} dimension.
         */
        public Builder dimension(String key, String... values) {
            return dimension(key, OtherPolicy.EXPLICIT, List.of(values));
        }

        /**
         * Adds or replaces one {@link OtherPolicy#EXPLICIT} dimension.
         */
        public Builder dimension(String key, Collection<String> values) {
            return dimension(key, OtherPolicy.EXPLICIT, values);
        }

        /**
         * Adds or replaces one dimension with an explicit policy.
         */
        public Builder dimension(String key, OtherPolicy policy, String... values) {
            return dimension(key, policy, List.of(values));
        }

        /**
         * Adds or replaces one dimension with an explicit policy.
         */
        public Builder dimension(String key, OtherPolicy policy, Collection<String> values) {
            definitions.put(key, new Declared(policy, new ArrayList<>(values)));
            return this;
        }

        public ContextDefinitions build() {
            return new ContextDefinitions(definitions);
        }
    }
}
