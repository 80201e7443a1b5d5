package com.enterprise.cte.graph;

import com.enterprise.cte.core.Cte;
import com.enterprise.cte.core.CteMapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adjacency projection for callers that draw or inspect the graph.
 */
public final class DependencyGraph {

    private DependencyGraph() {}

    /**
     * Name to declared dependency list, in mapping order. Dangling names are
     * kept; filtering them is the orderer's job, not this view's.
     */
    public static Map<String, List<String>> asAdjacency(CteMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Cte cte : mapping.ctes()) {
            adjacency.put(cte.name(), List.copyOf(cte.dependencies()));
        }
        return Collections.unmodifiableMap(adjacency);
    }

    /** Declared dependency names that are not keys of the mapping, per CTE. Empty lists omitted. */
    public static Map<String, List<String>> danglingReferences(CteMapping mapping) {
        Objects.requireNonNull(mapping, "mapping");
        Map<String, List<String>> dangling = new LinkedHashMap<>();
        for (Cte cte : mapping.ctes()) {
            List<String> missing = cte.dependencies().stream()
                    .filter(dep -> !mapping.contains(dep))
                    .distinct()
                    .toList();
            if (!missing.isEmpty()) {
                dangling.put(cte.name(), missing);
            }
        }
        return Collections.unmodifiableMap(dangling);
    }
}
