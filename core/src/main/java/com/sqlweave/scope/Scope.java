package com.sqlweave.scope;

import com.sqlweave.config.RenderSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rendering context threaded through every {@code toSQL} call.
 *
 * <p>A scope is built fresh for each statement by its statement builder and is
 * never mutated while rendering; {@link #withJoin(Join)} returns a new scope.
 * Expressions only read it, so the same expression tree may be rendered
 * against different scopes concurrently.
 *
 * @param database the database handle (may be null; the configured default dialect applies)
 * @param tables the contributing tables in FROM order, never empty
 * @param lastJoin the most recently added join (may be null)
 */
public record Scope(Database database, List<Table> tables, Join lastJoin) {

    public Scope {
        Objects.requireNonNull(tables, "tables must not be null");
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("scope requires at least one table");
        }
        tables = List.copyOf(tables);
    }

    /**
     * Creates a scope over one or more tables without joins.
     *
     * @param database the database handle (may be null)
     * @param table the first table
     * @param more additional tables
     * @return the scope
     */
    public static Scope of(Database database, Table table, Table... more) {
        List<Table> tables = new ArrayList<>(1 + more.length);
        tables.add(Objects.requireNonNull(table, "table must not be null"));
        tables.addAll(List.of(more));
        return new Scope(database, tables, null);
    }

    /**
     * Returns a scope with the join's table appended and the join recorded as
     * the most recent one.
     *
     * @param join the join
     * @return the new scope
     */
    public Scope withJoin(Join join) {
        Objects.requireNonNull(join, "join must not be null");
        List<Table> joined = new ArrayList<>(tables);
        joined.add(join.table());
        return new Scope(database, joined, join);
    }

    /**
     * Returns the dialect used to quote identifiers in this scope.
     *
     * @return the database's dialect, or the configured default
     */
    public Dialect dialect() {
        return database != null ? database.dialect() : RenderSettings.getDefaultDialect();
    }

    /**
     * Returns whether column names must be qualified with their table.
     *
     * @return true if more than one table contributes names
     */
    public boolean isMultiTable() {
        return tables.size() > 1 || lastJoin != null;
    }
}
