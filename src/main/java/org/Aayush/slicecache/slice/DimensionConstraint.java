package org.Aayush.slicecache.slice;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of dimension-constraint shapes a slice can be scoped by.
 *
 * <p>Only {@link Kind#EXACT} pins a single value and can take part in a provably complete
 * partition. The other shapes are retained so storage can round-trip them and so the
 * eligibility filter can exclude them by an exhaustive match over {@link Kind}.</p>
 */
public interface DimensionConstraint {

    /**
     * Constraint shape tag.
     */
    enum Kind {
        /** {@code context(key:value)}. */
        EXACT,
        /** {@code contextAny(key:a,b,...)}. */
        ANY_VALUE,
        /** {@code case(caseId:variant)}. */
        CASE_SELECTOR,
        /** {@code context(key:!value)}. */
        EXCLUSION
    }

    /**
     * Returns the shape tag.
     */
    Kind kind();

    /**
     * Returns canonical text used for dedupe keys and diagnostics.
     */
    String canonical();

    static DimensionConstraint exact(String value) {
        return new Exact(value);
    }

    static DimensionConstraint anyValue(List<String> values) {
        return new AnyValue(values);
    }

    static DimensionConstraint caseSelector(String caseId, String variant) {
        return new CaseSelector(caseId, variant);
    }

    static DimensionConstraint exclusion(String excludedValue) {
        return new Exclusion(excludedValue);
    }

    record Exact(String value) implements DimensionConstraint {
        public Exact {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.EXACT;
        }

        @Override
        public String canonical() {
            return value;
        }
    }

    record AnyValue(List<String> values) implements DimensionConstraint {
        public AnyValue {
            values = List.copyOf(Objects.requireNonNull(values, "values"));
        }

        @Override
        public Kind kind() {
            return Kind.ANY_VALUE;
        }

        @Override
        public String canonical() {
            return "any(" + String.join(",", values.stream().sorted().toList()) + ")";
        }
    }

    record CaseSelector(String caseId, String variant) implements DimensionConstraint {
        public CaseSelector {
            Objects.requireNonNull(caseId, "caseId");
            Objects.requireNonNull(variant, "variant");
        }

        @Override
        public Kind kind() {
            return Kind.CASE_SELECTOR;
        }

        @Override
        public String canonical() {
            return "case(" + caseId + ":" + variant + ")";
        }
    }

    record Exclusion(String excludedValue) implements DimensionConstraint {
        public Exclusion {
            Objects.requireNonNull(excludedValue, "excludedValue");
        }

        @Override
        public Kind kind() {
            return Kind.EXCLUSION;
        }

        @Override
        public String canonical() {
            return "!" + excludedValue;
        }
    }
}
