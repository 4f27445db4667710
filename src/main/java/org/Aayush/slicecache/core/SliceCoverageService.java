package org.Aayush.slicecache.core;

import org.Aayush.slicecache.context.ContextDefinitions;
import org.Aayush.slicecache.slice.Slice;

import java.util.List;

/**
 * Coverage-resolution API shared by the fetch planner and the execution layer.
 *
 * <p>Both call sites must go through the same implementation so the planner's view of
 * what is covered matches what execution aggregates.</p>
 */
public interface SliceCoverageService {

    /**
     * Resolves which cached slices answer a query and aggregates them.
     *
     * @param query structured query.
     * @param slices available slices (not mutated).
     * @param definitions live context definitions.
     * @return coverage result.
     * @throws CoverageResolutionException when the call contract is violated.
     */
    CoverageResult resolve(CoverageQuery query, List<Slice> slices, ContextDefinitions definitions);
}
