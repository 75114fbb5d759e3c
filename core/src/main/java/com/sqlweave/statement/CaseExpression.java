package com.sqlweave.statement;

import com.sqlweave.expression.Expression;

/**
 * A CASE expression under construction. Used as a value, it is closed with
 * {@link #end()} and rendered as the resulting expression.
 */
public interface CaseExpression {

    /**
     * Closes the CASE expression.
     *
     * @return the finished expression
     */
    Expression end();
}
