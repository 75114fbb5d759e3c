package com.sqlweave.expression;

import com.sqlweave.scope.Table;

/**
 * A column of a table, usable as an expression.
 */
public interface Field extends UnknownExpression {

    /**
     * Returns the column name.
     *
     * @return the column name
     */
    String name();

    /**
     * Returns the table the column belongs to.
     *
     * @return the table
     */
    Table table();
}
