package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Expression representing a BETWEEN predicate.
 *
 * <p>Examples:
 * <pre>
 *   price BETWEEN 10 AND 100
 *   created NOT BETWEEN '2024-01-01 00:00:00.000000' AND '2024-12-31 00:00:00.000000'
 * </pre>
 *
 * <p>The bounds are marshalled as plain values; they receive no parentheses
 * beyond what marshalling itself produces. The node is not classified as
 * boolean, so constant folding in AND/OR keeps it as an operand.
 */
public final class BetweenExpression implements UnknownExpression {

    private final Expression value;
    private final Object lower;
    private final Object upper;
    private final boolean negated;

    public BetweenExpression(Expression value, Object lower, Object upper, boolean negated) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.lower = lower;
        this.upper = upper;
        this.negated = negated;
    }

    public Expression value() {
        return value;
    }

    public Object lowerBound() {
        return lower;
    }

    public Object upperBound() {
        return upper;
    }

    public boolean negated() {
        return negated;
    }

    @Override
    public int precedence() {
        return Precedence.BETWEEN;
    }

    @Override
    public String toSQL(Scope scope) {
        String valueSql = value.toSQL(scope);
        String lowerSql = ValueMarshaller.marshal(scope, lower).sql();
        String upperSql = ValueMarshaller.marshal(scope, upper).sql();

        StringBuilder sql = new StringBuilder();
        BinaryExpression.appendOperand(sql, valueSql,
            Precedence.parenthesizeLeft(value.precedence(), Precedence.BETWEEN));
        sql.append(negated ? " NOT BETWEEN " : " BETWEEN ");
        sql.append(lowerSql).append(" AND ").append(upperSql);
        return sql.toString();
    }

    @Override
    public String toString() {
        return "BetweenExpression(" + value + (negated ? " NOT" : "") + " BETWEEN " + lower + " AND " + upper + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BetweenExpression that)) return false;
        return negated == that.negated &&
               Objects.equals(value, that.value) &&
               Objects.equals(lower, that.lower) &&
               Objects.equals(upper, that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, lower, upper, negated);
    }
}
