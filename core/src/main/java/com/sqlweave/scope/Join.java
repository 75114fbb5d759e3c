package com.sqlweave.scope;

/**
 * A join appended to a statement's FROM clause.
 *
 * <p>Only the joined table matters to the expression core: once a statement
 * has a join, column references must be qualified to stay unambiguous.
 */
public interface Join {

    /**
     * Returns the joined table.
     *
     * @return the table
     */
    Table table();
}
