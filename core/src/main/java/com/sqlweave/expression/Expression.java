package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

/**
 * Base interface for all expressions.
 *
 * <p>An expression is an immutable node of an expression tree that renders
 * itself to SQL text against a {@link Scope}. Every operator method returns a
 * new node and leaves the receiver untouched, so trees can be shared between
 * statements and rendered concurrently.
 *
 * <p>Operands of operator methods are arbitrary values: other expressions,
 * plain host values (numbers, strings, timestamps, lists), finalized
 * statements, tables or CASE builders. They are converted by
 * {@link com.sqlweave.generator.ValueMarshaller} when the tree is rendered.
 *
 * <p>Examples:
 * <pre>
 *   age.greaterThan(18)                 -- `age` &gt; 18
 *   name.in("a", "b")                   -- `name` IN ('a', 'b')
 *   price.between(10, 100)              -- `price` BETWEEN 10 AND 100
 *   score.ifNull(0).as("score")         -- IFNULL(`score`, 0) AS score
 * </pre>
 *
 * <p>The typed views {@link BooleanExpression}, {@link NumberExpression},
 * {@link StringExpression} and {@link DateExpression} add the operators that
 * make sense for each value kind; {@link UnknownExpression} offers all of them.
 */
public interface Expression {

    /**
     * Converts this expression to its SQL string representation.
     *
     * @param scope the rendering scope
     * @return the SQL string
     * @throws com.sqlweave.exception.SQLGenerationException if a nested value cannot be rendered
     */
    String toSQL(Scope scope);

    /**
     * Returns the binding strength of this expression's outermost operator.
     * Consulted only when this expression becomes an operand.
     *
     * @return the precedence level
     * @see Precedence
     */
    int precedence();

    /**
     * Returns whether this expression is the constant true.
     *
     * @return true for the constant true
     */
    default boolean isDefinitelyTrue() {
        return false;
    }

    /**
     * Returns whether this expression is the constant false.
     *
     * @return true for the constant false
     */
    default boolean isDefinitelyFalse() {
        return false;
    }

    /**
     * Returns whether this expression is known to produce a boolean.
     *
     * @return true for predicates and boolean constants
     */
    default boolean isBooleanTyped() {
        return false;
    }

    // ==================== Comparison ====================

    default BooleanExpression equalTo(Object other) {
        return OperatorCompiler.binary(this, "=", other, Precedence.COMPARISON, true);
    }

    default BooleanExpression notEqualTo(Object other) {
        return OperatorCompiler.binary(this, "<>", other, Precedence.COMPARISON, true);
    }

    default BooleanExpression lessThan(Object other) {
        return OperatorCompiler.binary(this, "<", other, Precedence.COMPARISON, true);
    }

    default BooleanExpression lessThanOrEqualTo(Object other) {
        return OperatorCompiler.binary(this, "<=", other, Precedence.COMPARISON, true);
    }

    default BooleanExpression greaterThan(Object other) {
        return OperatorCompiler.binary(this, ">", other, Precedence.COMPARISON, true);
    }

    default BooleanExpression greaterThanOrEqualTo(Object other) {
        return OperatorCompiler.binary(this, ">=", other, Precedence.COMPARISON, true);
    }

    // ==================== IS tests ====================

    default BooleanExpression isNull() {
        return OperatorCompiler.suffix(this, " IS NULL", Precedence.COMPARISON, true);
    }

    default BooleanExpression isNotNull() {
        return OperatorCompiler.suffix(this, " IS NOT NULL", Precedence.COMPARISON, true);
    }

    default BooleanExpression isTrue() {
        return OperatorCompiler.suffix(this, " IS TRUE", Precedence.COMPARISON, true);
    }

    default BooleanExpression isNotTrue() {
        return OperatorCompiler.suffix(this, " IS NOT TRUE", Precedence.COMPARISON, true);
    }

    default BooleanExpression isFalse() {
        return OperatorCompiler.suffix(this, " IS FALSE", Precedence.COMPARISON, true);
    }

    default BooleanExpression isNotFalse() {
        return OperatorCompiler.suffix(this, " IS NOT FALSE", Precedence.COMPARISON, true);
    }

    // ==================== Set membership and ranges ====================

    /**
     * Tests membership in a list of values. Arrays, iterables and optionals
     * among the values are flattened first.
     *
     * <ul>
     *   <li>no values - the constant false</li>
     *   <li>one finalized select - {@code expr IN (SELECT ...)}</li>
     *   <li>one other value - {@code expr = value}</li>
     *   <li>several values - {@code expr IN (v1, v2, ...)}</li>
     * </ul>
     *
     * @param values the values
     * @return the predicate
     */
    default BooleanExpression in(Object... values) {
        return OperatorCompiler.in(this, false, values);
    }

    /**
     * Negated form of {@link #in(Object...)}; no values yield the constant true
     * and a single value degrades to {@code expr <> value}.
     *
     * @param values the values
     * @return the predicate
     */
    default BooleanExpression notIn(Object... values) {
        return OperatorCompiler.in(this, true, values);
    }

    default BooleanExpression between(Object min, Object max) {
        return OperatorCompiler.between(this, min, max, false);
    }

    default BooleanExpression notBetween(Object min, Object max) {
        return OperatorCompiler.between(this, min, max, true);
    }

    // ==================== Conditionals ====================

    /**
     * Uses this expression as the predicate of {@code IF(this, trueValue, falseValue)}.
     */
    default UnknownExpression ifThenElse(Object trueValue, Object falseValue) {
        return Expressions.ifThenElse(this, trueValue, falseValue);
    }

    default UnknownExpression ifNull(Object altValue) {
        return Expressions.function("IFNULL", this, altValue);
    }

    // ==================== Select list and ordering ====================

    default Alias as(String alias) {
        return new AliasExpression(this, alias);
    }

    default OrderBy asc() {
        return new OrderBy(this, false);
    }

    default OrderBy desc() {
        return new OrderBy(this, true);
    }
}
