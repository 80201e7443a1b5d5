package com.enterprise.cte.graph;

import com.enterprise.cte.core.CteMapping;
import com.enterprise.cte.core.CteNotFoundException;

import java.util.List;
import java.util.Objects;

/**
 * Definition order for CTEs: every CTE appears after all of its in-mapping
 * dependencies. Output depends only on the mapping's iteration order and the
 * order of each dependency list, so repeated calls produce identical lists.
 *
 * <p>All methods throw {@link com.enterprise.cte.core.CircularDependencyException}
 * when the walk meets a cycle.
 */
public final class TopologicalOrderer {

    private TopologicalOrderer() {}

    /**
     * CTEs reachable from {@code target}, ending with {@code target} itself.
     *
     * @throws CteNotFoundException if {@code target} is not in the mapping
     */
    public static List<String> orderForTarget(String target, CteMapping mapping) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(mapping, "mapping");
        if (!mapping.contains(target)) {
            throw new CteNotFoundException(target);
        }
        return List.copyOf(new DependencyWalker(mapping).visit(target).order());
    }

    /** Every CTE of the mapping, seeded from each key in mapping order. */
    public static List<String> orderForAll(CteMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        return List.copyOf(new DependencyWalker(mapping).visitAll().order());
    }

    /** {@link #orderForTarget} without the target: what must be defined before it. */
    public static List<String> transitiveDependencies(String target, CteMapping mapping) {
        List<String> order = orderForTarget(target, mapping);
        return order.subList(0, order.size() - 1);
    }
}
