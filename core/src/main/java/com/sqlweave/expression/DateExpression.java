package com.sqlweave.expression;

/**
 * An expression with a date or timestamp value.
 */
public interface DateExpression extends Expression {

    default UnknownExpression min() {
        return Expressions.function("MIN", this);
    }

    default UnknownExpression max() {
        return Expressions.function("MAX", this);
    }
}
