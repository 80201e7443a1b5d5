package com.enterprise.cte.core;

import java.util.List;

/**
 * A traversal reached a CTE that is still on its own path.
 *
 * <p>{@link #cteName()} is the node where the cycle closed. {@link #cyclePath()}
 * starts and ends with that node, e.g. {@code [a, b, c, a]}.
 */
public class CircularDependencyException extends CteResolutionException {

    private final List<String> cyclePath;

    public CircularDependencyException(String cteName, List<String> cyclePath) {
        super(cteName, "Circular dependency detected: " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> cyclePath() {
        return cyclePath;
    }
}
