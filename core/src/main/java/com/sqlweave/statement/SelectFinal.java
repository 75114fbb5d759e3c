package com.sqlweave.statement;

/**
 * A SELECT statement that is complete and can be rendered on its own.
 *
 * <p>Used as an operand, a finalized select is always wrapped in parentheses
 * (a scalar subquery); as the single value of {@code IN} it becomes the
 * subquery of {@code expr IN (SELECT ...)}.
 */
@FunctionalInterface
public interface SelectFinal {

    /**
     * Renders the complete statement.
     *
     * @return the SQL text
     */
    String toSQL();
}
