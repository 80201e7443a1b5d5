package com.enterprise.cte.core;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The universe of CTEs visible to one resolution request, keyed by name.
 *
 * <p>A mapping is an insertion-ordered snapshot: the entries are copied on
 * construction and cannot change afterwards. Iteration order is the order the
 * CTEs were supplied in, and every ordering produced from the mapping follows it.
 *
 * <pre>{@code
 * CteMapping mapping = CteMapping.of(
 *         Cte.of("active_users", "SELECT id FROM users WHERE active"),
 *         Cte.of("user_stats", "SELECT COUNT(*) FROM active_users", "active_users"));
 * }</pre>
 */
public final class CteMapping {

    private static final CteMapping EMPTY = new CteMapping(new LinkedHashMap<>());

    private final Map<String, Cte> ctes;

    private CteMapping(Map<String, Cte> ctes) {
        this.ctes = Collections.unmodifiableMap(ctes);
    }

    // ==================== Factories ====================

    public static CteMapping empty() {
        return EMPTY;
    }

    public static CteMapping of(Cte... ctes) {
        return copyOf(Arrays.asList(ctes));
    }

    /** Keys by {@link Cte#name()}; duplicate names are rejected. */
    public static CteMapping copyOf(Collection<Cte> ctes) {
        Map<String, Cte> copy = new LinkedHashMap<>();
        for (Cte cte : ctes) {
            Objects.requireNonNull(cte, "cte");
            if (copy.putIfAbsent(cte.name(), cte) != null) {
                throw new IllegalArgumentException("Duplicate CTE name: " + cte.name());
            }
        }
        return new CteMapping(copy);
    }

    /**
     * Copies a name-keyed map, preserving its iteration order. Each key must
     * equal the name of the CTE stored under it.
     */
    public static CteMapping copyOf(Map<String, Cte> ctes) {
        Map<String, Cte> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Cte> entry : ctes.entrySet()) {
            Cte cte = Objects.requireNonNull(entry.getValue(), "cte");
            if (!cte.name().equals(entry.getKey())) {
                throw new IllegalArgumentException(
                        "CTE keyed as '" + entry.getKey() + "' is named '" + cte.name() + "'");
            }
            copy.put(entry.getKey(), cte);
        }
        return new CteMapping(copy);
    }

    /** Returns a copy with {@code cte} added, or replacing the entry of the same name in place. */
    public CteMapping with(Cte cte) {
        Objects.requireNonNull(cte, "cte");
        Map<String, Cte> copy = new LinkedHashMap<>(ctes);
        copy.put(cte.name(), cte);
        return new CteMapping(copy);
    }

    // ==================== Lookup ====================

    public boolean contains(String name) {
        return ctes.containsKey(name);
    }

    public Optional<Cte> find(String name) {
        return Optional.ofNullable(ctes.get(name));
    }

    public Cte require(String name) {
        Cte cte = ctes.get(name);
        if (cte == null) {
            throw new CteNotFoundException(name);
        }
        return cte;
    }

    /** Names in iteration order. */
    public Set<String> names() {
        return ctes.keySet();
    }

    public Collection<Cte> ctes() {
        return ctes.values();
    }

    public Map<String, Cte> asMap() {
        return ctes;
    }

    public int size() {
        return ctes.size();
    }

    public boolean isEmpty() {
        return ctes.isEmpty();
    }

    /** Order-sensitive: mappings with the same entries in a different order are not equal. */
    @Override
    public boolean equals(Object o) {
        return o instanceof CteMapping other && entries().equals(other.entries());
    }

    @Override
    public int hashCode() {
        return entries().hashCode();
    }

    private List<Map.Entry<String, Cte>> entries() {
        return List.copyOf(ctes.entrySet());
    }

    @Override
    public String toString() {
        return "CteMapping" + ctes.keySet();
    }
}
