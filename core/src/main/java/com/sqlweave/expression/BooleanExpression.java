package com.sqlweave.expression;

/**
 * An expression with a boolean value.
 *
 * <p>{@code and}, {@code or} and {@code not} fold the constants produced by
 * {@link Expressions#alwaysTrue()} and {@link Expressions#alwaysFalse()}:
 * <pre>
 *   alwaysFalse().and(x)    -- 0
 *   alwaysTrue().or(x)      -- 1
 *   alwaysTrue().and(p)     -- p, when p is a predicate
 *   alwaysTrue().not()      -- 0
 * </pre>
 * No other algebraic simplification is performed; {@code p.not().not()}
 * renders both negations.
 */
public interface BooleanExpression extends Expression {

    default BooleanExpression and(Object other) {
        return OperatorCompiler.and(this, other);
    }

    default BooleanExpression or(Object other) {
        return OperatorCompiler.or(this, other);
    }

    default BooleanExpression xor(Object other) {
        return OperatorCompiler.binary(this, "XOR", other, Precedence.XOR, true);
    }

    default BooleanExpression not() {
        return OperatorCompiler.not(this);
    }
}
