package com.enterprise.cte.compose;

import com.enterprise.cte.core.CteMapping;
import com.enterprise.cte.graph.TopologicalOrderer;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a decomposed set of CTEs back into one statement.
 *
 * <p>The SQL bodies are treated as opaque text: nothing here parses, validates
 * or reformats them beyond indenting each line by one unit.
 *
 * <p>Example, for {@code a} depending on {@code b}:
 * <pre>{@code
 * SqlRecomposer.standard().resolve("a", mapping);
 *
 * // WITH b AS (
 * //     SELECT 1
 * // )
 * // SELECT * FROM a
 * }</pre>
 */
public final class SqlRecomposer {

    public static final int DEFAULT_INDENT = 4;

    private static final SqlRecomposer STANDARD = new SqlRecomposer(DEFAULT_INDENT);

    // Leading "--" comment lines and whitespace, then WITH [RECURSIVE]
    private static final Pattern LEADING_WITH = Pattern.compile(
            "^((?:\\s*--[^\\n]*\\n)*\\s*)(with(?:\\s+recursive)?)\\s+",
            Pattern.CASE_INSENSITIVE);

    private final String indent;

    private SqlRecomposer(int indentWidth) {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("Indent width cannot be negative: " + indentWidth);
        }
        this.indent = " ".repeat(indentWidth);
    }

    // ==================== Factory ====================

    /** Four-space indentation. */
    public static SqlRecomposer standard() {
        return STANDARD;
    }

    public static SqlRecomposer withIndent(int indentWidth) {
        return indentWidth == DEFAULT_INDENT ? STANDARD : new SqlRecomposer(indentWidth);
    }

    public int indentWidth() {
        return indent.length();
    }

    // ==================== Recomposition ====================

    /**
     * Executable SQL for {@code target}: a {@code WITH} block defining every CTE
     * the target depends on, followed by {@code SELECT * FROM target}. A target
     * without in-mapping dependencies is returned as its own query, verbatim.
     *
     * @throws com.enterprise.cte.core.CteNotFoundException if {@code target} is not in the mapping
     * @throws com.enterprise.cte.core.CircularDependencyException if the walk from {@code target} meets a cycle
     */
    public String resolve(String target, CteMapping mapping) {
        List<String> order = TopologicalOrderer.orderForTarget(target, mapping);
        if (order.size() == 1) {
            return mapping.require(target).query();
        }
        return withClause(order.subList(0, order.size() - 1), mapping)
                + "\nSELECT * FROM " + target;
    }

    /**
     * Prepends every CTE of the mapping, in definition order, to the main query.
     * An empty mapping yields {@code mainQuery} unchanged.
     *
     * <p>If the main query already opens with {@code WITH} (after leading
     * whitespace and {@code --} comment lines), the generated CTEs are placed
     * right after that keyword, ahead of the existing ones, so the result keeps
     * a single {@code WITH}.
     *
     * @throws com.enterprise.cte.core.CircularDependencyException if the mapping has a cycle
     */
    public String compose(String mainQuery, CteMapping mapping) {
        Objects.requireNonNull(mainQuery, "mainQuery");
        List<String> order = TopologicalOrderer.orderForAll(mapping);
        if (order.isEmpty()) {
            return mainQuery;
        }
        Matcher existing = LEADING_WITH.matcher(mainQuery);
        if (existing.find()) {
            return existing.group(1) + existing.group(2) + " "
                    + definitions(order, mapping) + ",\n"
                    + mainQuery.substring(existing.end());
        }
        return withClause(order, mapping) + "\n" + mainQuery;
    }

    private String withClause(List<String> names, CteMapping mapping) {
        return "WITH " + definitions(names, mapping);
    }

    private String definitions(List<String> names, CteMapping mapping) {
        return names.stream()
                .map(name -> definition(name, mapping.require(name).query()))
                .collect(Collectors.joining(",\n"));
    }

    private String definition(String name, String query) {
        return name + " AS (\n" + indent(query) + "\n)";
    }

    private String indent(String query) {
        return indent + query.replace("\n", "\n" + indent);
    }
}
