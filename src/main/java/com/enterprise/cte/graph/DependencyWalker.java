package com.enterprise.cte.graph;

import com.enterprise.cte.core.CircularDependencyException;
import com.enterprise.cte.core.Cte;
import com.enterprise.cte.core.CteMapping;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Post-order depth-first walk over a {@link CteMapping}. One instance per call;
 * the in-progress and done sets never outlive the operation that created them.
 *
 * <p>Edges to names that are not keys of the mapping are skipped. Reaching a
 * node that is still in progress throws {@link CircularDependencyException}.
 *
 * <p>Uses an explicit stack, so arbitrarily long dependency chains are fine.
 */
final class DependencyWalker {

    private final CteMapping mapping;

    // Insertion order is the current path: only the most recently entered node is ever removed
    private final Set<String> inProgress = new LinkedHashSet<>();
    private final Set<String> done = new HashSet<>();
    private final List<String> order = new ArrayList<>();

    DependencyWalker(CteMapping mapping) {
        this.mapping = mapping;
    }

    /** Visits {@code root} (a key of the mapping) and everything it reaches. */
    DependencyWalker visit(String root) {
        if (done.contains(root)) {
            return this;
        }
        Deque<Frame> stack = new ArrayDeque<>();
        enter(root, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending().hasNext()) {
                String dependency = frame.pending().next();
                if (!mapping.contains(dependency) || done.contains(dependency)) {
                    continue;
                }
                if (inProgress.contains(dependency)) {
                    throw new CircularDependencyException(dependency, pathClosingAt(dependency));
                }
                enter(dependency, stack);
            } else {
                stack.pop();
                inProgress.remove(frame.name());
                done.add(frame.name());
                order.add(frame.name());
            }
        }
        return this;
    }

    /** Visits every key, in mapping order. */
    DependencyWalker visitAll() {
        for (String name : mapping.names()) {
            visit(name);
        }
        return this;
    }

    /** Names in the order they were completed: dependencies before dependents. */
    List<String> order() {
        return Collections.unmodifiableList(order);
    }

    private void enter(String name, Deque<Frame> stack) {
        Cte cte = mapping.require(name);
        inProgress.add(name);
        stack.push(new Frame(name, cte.dependencies().iterator()));
    }

    private List<String> pathClosingAt(String repeated) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        for (String node : inProgress) {
            inCycle = inCycle || node.equals(repeated);
            if (inCycle) {
                path.add(node);
            }
        }
        path.add(repeated);
        return path;
    }

    private record Frame(String name, Iterator<String> pending) {}
}
