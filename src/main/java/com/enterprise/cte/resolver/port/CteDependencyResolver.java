package com.enterprise.cte.resolver.port;

import com.enterprise.cte.core.CteMapping;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Contract used by command and HTTP handlers to work with a decomposed query.
 *
 * <p>Every call takes the complete mapping it should operate on and keeps no
 * state between calls. Implementations must not retain the mapping.
 *
 * <p>Register the default implementation as a Spring bean:
 * <pre>{@code
 * @Import(CteResolverConfig.class)
 * @Configuration
 * public class WorkspaceConfig { ... }
 * }</pre>
 *
 * <p>Failures are {@link com.enterprise.cte.core.CteNotFoundException} for an
 * unknown target and {@link com.enterprise.cte.core.CircularDependencyException}
 * for a cycle; turning them into user-facing messages is the caller's job.
 */
public interface CteDependencyResolver {

    /** {@code false} if any cycle exists anywhere in the mapping. */
    boolean validateNoCycles(CteMapping mapping);

    /** First cycle found, as a path that starts and ends with the same CTE. */
    Optional<List<String>> findCycle(CteMapping mapping);

    /** Definition order of everything {@code target} needs, {@code target} last. */
    List<String> orderForTarget(String target, CteMapping mapping);

    /** Definition order of every CTE in the mapping. */
    List<String> orderForAll(CteMapping mapping);

    /** Direct dependents of {@code name}, in mapping order. */
    List<String> findDependents(String name, CteMapping mapping);

    /** Declared dependencies per CTE, dangling names included. */
    Map<String, List<String>> asAdjacency(CteMapping mapping);

    /** Executable SQL for one CTE with its dependencies inlined as a WITH clause. */
    String resolve(String target, CteMapping mapping);

    /** The main query with every CTE of the mapping prepended as a WITH clause. */
    String compose(String mainQuery, CteMapping mapping);
}
