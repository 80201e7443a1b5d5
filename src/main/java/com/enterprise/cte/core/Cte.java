package com.enterprise.cte.core;

import com.enterprise.cte.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named query fragment produced by decomposing a {@code WITH ... SELECT ...}
 * statement: the body of {@code name AS (...)} plus the names it references.
 *
 * <p>Instances are immutable. The {@code with*} methods return modified copies,
 * so a {@link CteMapping} built from them can be handed to any number of
 * resolution calls without being affected by later edits.
 *
 * <p>Example:
 * <pre>{@code
 * Cte stats = Cte.of("user_stats",
 *         "SELECT user_id, COUNT(*) AS cnt FROM active_users GROUP BY user_id",
 *         "active_users");
 * }</pre>
 *
 * @param name         unique, case-sensitive identifier within one mapping
 * @param query        SQL body without the {@code name AS (...)} wrapper
 * @param dependencies referenced names; names missing from the mapping are external tables
 * @param description  optional, informational
 * @param columns      optional column metadata
 */
public record Cte(String name,
                  String query,
                  List<String> dependencies,
                  String description,
                  List<ColumnInfo> columns) {

    public Cte {
        IdentifierValidator.validateCteName(name);
        query = query == null ? "" : query;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public Cte(String name, String query, List<String> dependencies) {
        this(name, query, dependencies, null, List.of());
    }

    // ==================== Factories ====================

    public static Cte of(String name, String query, String... dependencies) {
        return new Cte(name, query, Arrays.asList(dependencies));
    }

    /** A CTE whose dependencies have not been extracted yet. */
    public static Cte create(String name, String query, String description) {
        return new Cte(name, query, List.of(), description, List.of());
    }

    // ==================== Derivation ====================

    /**
     * Replaces the body. Dependencies are cleared because the new body has not
     * been analysed; the decomposition step is expected to supply them again.
     */
    public Cte withQuery(String newQuery) {
        return new Cte(name, newQuery, List.of(), description, columns);
    }

    public Cte withDependencies(List<String> newDependencies) {
        return new Cte(name, query, newDependencies, description, columns);
    }

    /** Adds a dependency unless it is already listed. */
    public Cte withDependency(String dependency) {
        Objects.requireNonNull(dependency, "dependency");
        if (dependencies.contains(dependency)) {
            return this;
        }
        List<String> updated = new ArrayList<>(dependencies);
        updated.add(dependency);
        return withDependencies(updated);
    }

    public Cte withoutDependency(String dependency) {
        if (!dependencies.contains(dependency)) {
            return this;
        }
        return withDependencies(dependencies.stream()
                .filter(dep -> !dep.equals(dependency))
                .toList());
    }

    public Cte withDescription(String newDescription) {
        return new Cte(name, query, dependencies, newDescription, columns);
    }

    public Cte withColumns(List<ColumnInfo> newColumns) {
        return new Cte(name, query, dependencies, description, newColumns);
    }

    // ==================== Queries ====================

    public boolean hasDependency(String dependency) {
        return dependencies.contains(dependency);
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnInfo::name).toList();
    }
}
