package org.Aayush.slicecache.generation;

/**
 * How a generation answers a query.
 */
public enum CoverageKind {
    /** Generation key set equals the requested breakdown. */
    EXACT,
    /** Finer generation summed down to an uncontexted total. */
    REDUCTION
}
