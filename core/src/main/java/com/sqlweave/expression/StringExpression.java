package com.sqlweave.expression;

/**
 * An expression with a string value.
 *
 * <p>All helpers are plain function calls and comparisons:
 * <pre>
 *   name.contains("x")      -- LOCATE('x', `name`) &gt; 0
 *   name.hasPrefix("ab")    -- LEFT(`name`, CHAR_LENGTH('ab')) = 'ab'
 *   name.ifEmpty("n/a")     -- IF(`name` &lt;&gt; '', `name`, 'n/a')
 *   name.isEmpty()          -- `name` = ''
 * </pre>
 */
public interface StringExpression extends Expression {

    default BooleanExpression like(Object pattern) {
        return OperatorCompiler.binary(this, "LIKE", pattern, Precedence.COMPARISON, true);
    }

    default BooleanExpression contains(String substring) {
        return Expressions.function("LOCATE", substring, this).greaterThan(0);
    }

    default BooleanExpression hasPrefix(Object prefix) {
        return left(Expressions.function("CHAR_LENGTH", prefix)).equalTo(prefix);
    }

    default BooleanExpression hasSuffix(Object suffix) {
        return right(Expressions.function("CHAR_LENGTH", suffix)).equalTo(suffix);
    }

    default BooleanExpression isEmpty() {
        return equalTo("");
    }

    default StringExpression ifEmpty(Object altValue) {
        return Expressions.ifThenElse(notEqualTo(""), this, altValue);
    }

    default StringExpression concat(Object other) {
        return Expressions.concat(this, other);
    }

    default StringExpression lower() {
        return Expressions.function("LOWER", this);
    }

    default StringExpression upper() {
        return Expressions.function("UPPER", this);
    }

    /** The first {@code count} characters. */
    default StringExpression left(Object count) {
        return Expressions.function("LEFT", this, count);
    }

    /** The last {@code count} characters. */
    default StringExpression right(Object count) {
        return Expressions.function("RIGHT", this, count);
    }

    default StringExpression trim() {
        return Expressions.function("TRIM", this);
    }

    default NumberExpression charLength() {
        return Expressions.function("CHAR_LENGTH", this);
    }

    default UnknownExpression min() {
        return Expressions.function("MIN", this);
    }

    default UnknownExpression max() {
        return Expressions.function("MAX", this);
    }
}
