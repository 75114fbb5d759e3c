package com.sqlweave.expression;

/**
 * An expression with a numeric value.
 */
public interface NumberExpression extends Expression {

    default NumberExpression add(Object other) {
        return OperatorCompiler.binary(this, "+", other, Precedence.ADDITIVE, false);
    }

    default NumberExpression sub(Object other) {
        return OperatorCompiler.binary(this, "-", other, Precedence.ADDITIVE, false);
    }

    default NumberExpression mul(Object other) {
        return OperatorCompiler.binary(this, "*", other, Precedence.MULTIPLICATIVE, false);
    }

    default NumberExpression div(Object other) {
        return OperatorCompiler.binary(this, "/", other, Precedence.MULTIPLICATIVE, false);
    }

    /** Integer division, {@code a DIV b}. */
    default NumberExpression intDiv(Object other) {
        return OperatorCompiler.binary(this, "DIV", other, Precedence.MULTIPLICATIVE, false);
    }

    default NumberExpression mod(Object other) {
        return OperatorCompiler.binary(this, "%", other, Precedence.MULTIPLICATIVE, false);
    }

    default NumberExpression negate() {
        return OperatorCompiler.prefix(this, "-", Precedence.UNARY, false);
    }

    default NumberExpression bitNot() {
        return OperatorCompiler.prefix(this, "~", Precedence.UNARY, false);
    }

    default NumberExpression bitAnd(Object other) {
        return OperatorCompiler.binary(this, "&", other, Precedence.BIT_AND, false);
    }

    default NumberExpression bitOr(Object other) {
        return OperatorCompiler.binary(this, "|", other, Precedence.BIT_OR, false);
    }

    default NumberExpression shiftLeft(Object other) {
        return OperatorCompiler.binary(this, "<<", other, Precedence.SHIFT, false);
    }

    default NumberExpression shiftRight(Object other) {
        return OperatorCompiler.binary(this, ">>", other, Precedence.SHIFT, false);
    }

    // ==================== Aggregates ====================

    default NumberExpression sum() {
        return Expressions.function("SUM", this);
    }

    default NumberExpression avg() {
        return Expressions.function("AVG", this);
    }

    default NumberExpression count() {
        return Expressions.function("COUNT", this);
    }

    default UnknownExpression min() {
        return Expressions.function("MIN", this);
    }

    default UnknownExpression max() {
        return Expressions.function("MAX", this);
    }
}
