package com.sqlweave.scope;

/**
 * Handle to the database a statement is built for.
 *
 * <p>The connection and execution layer owns the real implementation; the
 * expression core only needs the dialect to quote identifiers.
 */
public interface Database {

    /**
     * Returns the SQL dialect spoken by this database.
     *
     * @return the dialect
     */
    Dialect dialect();

    /**
     * Creates a detached handle that only carries a dialect.
     *
     * @param dialect the dialect
     * @return the database handle
     */
    static Database of(Dialect dialect) {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect must not be null");
        }
        return () -> dialect;
    }
}
