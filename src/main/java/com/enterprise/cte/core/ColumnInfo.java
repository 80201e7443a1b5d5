package com.enterprise.cte.core;

import java.util.Objects;

/**
 * Column metadata attached to a {@link Cte}. Informational only; the graph
 * algorithms never look at it.
 *
 * @param name     column name as it appears in the CTE's select list
 * @param type     SQL type name, free-form
 * @param nullable {@code null} when unknown
 */
public record ColumnInfo(String name, String type, Boolean nullable) {

    public ColumnInfo {
        Objects.requireNonNull(name, "column name");
        type = type == null ? "" : type;
    }

    public static ColumnInfo of(String name, String type) {
        return new ColumnInfo(name, type, null);
    }
}
