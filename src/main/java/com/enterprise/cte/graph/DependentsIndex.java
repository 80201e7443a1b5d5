package com.enterprise.cte.graph;

import com.enterprise.cte.core.Cte;
import com.enterprise.cte.core.CteMapping;

import java.util.List;
import java.util.Objects;

/**
 * Reverse lookup over declared dependencies. Direct dependents only.
 */
public final class DependentsIndex {

    private DependentsIndex() {}

    /** CTEs whose dependency list names {@code name}, in mapping order. */
    public static List<String> findDependents(String name, CteMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        return mapping.ctes().stream()
                .filter(cte -> cte.hasDependency(name))
                .map(Cte::name)
                .toList();
    }
}
