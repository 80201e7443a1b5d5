package com.enterprise.cte.debug;

import com.enterprise.cte.core.CteMapping;
import com.enterprise.cte.graph.CycleValidator;
import com.enterprise.cte.graph.DependencyGraph;
import com.enterprise.cte.graph.DependentsIndex;
import com.enterprise.cte.graph.TopologicalOrderer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Debug utility: formats a {@link CteMapping} showing declared dependencies
 * (dangling names marked), the definition order or the cycle that prevents one,
 * and the direct dependents of every CTE.
 */
public final class GraphDebugger {

    private GraphDebugger() {}

    public static String format(CteMapping mapping) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== CTE Graph Debug ===\n");

        Map<String, List<String>> adjacency = DependencyGraph.asAdjacency(mapping);
        Map<String, List<String>> dangling = DependencyGraph.danglingReferences(mapping);
        sb.append("Dependencies (").append(adjacency.size()).append("):\n");
        for (Map.Entry<String, List<String>> e : adjacency.entrySet()) {
            List<String> missing = dangling.getOrDefault(e.getKey(), List.of());
            sb.append("  ").append(e.getKey()).append(" -> [");
            sb.append(String.join(", ", e.getValue().stream()
                    .map(dep -> missing.contains(dep) ? dep + " (external)" : dep)
                    .toList()));
            sb.append("]\n");
        }

        Optional<List<String>> cycle = CycleValidator.findCycle(mapping);
        if (cycle.isPresent()) {
            sb.append("Cycle:\n  ").append(String.join(" -> ", cycle.get())).append("\n");
        } else {
            sb.append("Definition order:\n  ")
                    .append(String.join(", ", TopologicalOrderer.orderForAll(mapping)))
                    .append("\n");
        }

        sb.append("Dependents:\n");
        for (String name : mapping.names()) {
            sb.append("  ").append(name).append(" <- [")
                    .append(String.join(", ", DependentsIndex.findDependents(name, mapping)))
                    .append("]\n");
        }
        sb.append("=======================");
        return sb.toString();
    }
}
