package com.enterprise.cte.graph;

import com.enterprise.cte.core.CircularDependencyException;
import com.enterprise.cte.core.CteMapping;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Global acyclicity check. Unlike {@link TopologicalOrderer#orderForTarget},
 * every CTE of the mapping is a traversal root, so a cycle is found even when
 * nothing the caller is currently interested in touches it.
 */
public final class CycleValidator {

    private CycleValidator() {}

    /** {@code true} when the mapping is a DAG (dangling names ignored). */
    public static boolean validateNoCycles(CteMapping mapping) {
        return findCycle(mapping).isEmpty();
    }

    public static boolean hasCycle(CteMapping mapping) {
        return !validateNoCycles(mapping);
    }

    /**
     * Returns the first cycle met while walking the mapping in iteration order,
     * as a path whose first and last element are the same CTE.
     */
    public static Optional<List<String>> findCycle(CteMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        try {
            new DependencyWalker(mapping).visitAll();
            return Optional.empty();
        } catch (CircularDependencyException e) {
            return Optional.of(e.cyclePath());
        }
    }
}
