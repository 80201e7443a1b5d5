package com.enterprise.cte.resolver.adapter;

import com.enterprise.cte.compose.SqlRecomposer;
import com.enterprise.cte.core.CircularDependencyException;
import com.enterprise.cte.core.CteMapping;
import com.enterprise.cte.graph.CycleValidator;
import com.enterprise.cte.graph.DependencyGraph;
import com.enterprise.cte.graph.DependentsIndex;
import com.enterprise.cte.graph.TopologicalOrderer;
import com.enterprise.cte.resolver.port.CteDependencyResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link CteDependencyResolver} backed by the static graph operations and an
 * {@link SqlRecomposer}. Stateless apart from the recomposer's indentation,
 * so one instance can serve concurrent requests.
 */
public class DefaultCteDependencyResolver implements CteDependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultCteDependencyResolver.class);

    private final SqlRecomposer recomposer;

    public DefaultCteDependencyResolver() {
        this(SqlRecomposer.standard());
    }

    public DefaultCteDependencyResolver(SqlRecomposer recomposer) {
        this.recomposer = Objects.requireNonNull(recomposer);
    }

    @Override
    public boolean validateNoCycles(CteMapping mapping) {
        Optional<List<String>> cycle = findCycle(mapping);
        cycle.ifPresent(path -> log.warn("Circular dependency among CTEs: {}", String.join(" -> ", path)));
        return cycle.isEmpty();
    }

    @Override
    public Optional<List<String>> findCycle(CteMapping mapping) {
        return CycleValidator.findCycle(mapping);
    }

    @Override
    public List<String> orderForTarget(String target, CteMapping mapping) {
        List<String> order = traced(target, () -> TopologicalOrderer.orderForTarget(target, mapping));
        log.debug("Definition order for '{}': {}", target, order);
        return order;
    }

    @Override
    public List<String> orderForAll(CteMapping mapping) {
        List<String> order = traced(null, () -> TopologicalOrderer.orderForAll(mapping));
        log.debug("Definition order for {} CTEs: {}", order.size(), order);
        return order;
    }

    @Override
    public List<String> findDependents(String name, CteMapping mapping) {
        return DependentsIndex.findDependents(name, mapping);
    }

    @Override
    public Map<String, List<String>> asAdjacency(CteMapping mapping) {
        return DependencyGraph.asAdjacency(mapping);
    }

    @Override
    public String resolve(String target, CteMapping mapping) {
        String sql = traced(target, () -> recomposer.resolve(target, mapping));
        log.debug("Resolved '{}' to {} chars of SQL", target, sql.length());
        return sql;
    }

    @Override
    public String compose(String mainQuery, CteMapping mapping) {
        String sql = traced(null, () -> recomposer.compose(mainQuery, mapping));
        log.debug("Composed main query with {} CTEs", mapping.size());
        return sql;
    }

    public SqlRecomposer recomposer() {
        return recomposer;
    }

    private <T> T traced(String target, Operation<T> operation) {
        try {
            return operation.run();
        } catch (CircularDependencyException e) {
            log.warn("Cannot order CTEs{}: {}",
                    target == null ? "" : " for '" + target + "'", e.getMessage());
            throw e;
        }
    }

    @FunctionalInterface
    private interface Operation<T> { T run(); }
}
