package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;
import com.sqlweave.statement.SelectFinal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing an IN clause (or NOT IN clause).
 *
 * <p>SQL form: expr IN (val1, val2, val3)
 * <p>SQL form (negated): expr NOT IN (val1, val2, val3)
 * <p>SQL form (subquery): expr IN (SELECT ...)
 *
 * <p>Instances are normally produced by {@link Expression#in(Object...)},
 * which has already flattened the values and handled the empty and
 * single-scalar cases. Each value is marshalled on its own and is not
 * parenthesized individually. Like BETWEEN, the node is not classified as
 * boolean.
 */
public final class InExpression implements UnknownExpression {

    private final Expression testExpr;
    private final List<Object> values;
    private final boolean negated;

    /**
     * Creates an IN expression.
     *
     * @param testExpr the expression being tested
     * @param values the flattened values to test against
     * @param negated true for NOT IN, false for IN
     * @throws IllegalArgumentException if values is empty
     */
    public InExpression(Expression testExpr, List<?> values, boolean negated) {
        this.testExpr = Objects.requireNonNull(testExpr, "testExpr must not be null");
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN clause requires at least one value");
        }
        this.values = new ArrayList<>(values);
        this.negated = negated;
    }

    public Expression testExpr() {
        return testExpr;
    }

    /**
     * Returns the values in the IN list.
     *
     * @return an unmodifiable list of values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return negated;
    }

    /**
     * Returns whether this tests membership in a subquery.
     *
     * @return true if the only value is a finalized select
     */
    public boolean isSubquery() {
        return values.size() == 1 && values.get(0) instanceof SelectFinal;
    }

    @Override
    public int precedence() {
        return Precedence.COMPARISON;
    }

    @Override
    public String toSQL(Scope scope) {
        String valuesSql = isSubquery()
            ? ((SelectFinal) values.get(0)).toSQL()
            : ValueMarshaller.commaValues(scope, values);
        String exprSql = testExpr.toSQL(scope);

        StringBuilder sql = new StringBuilder();
        BinaryExpression.appendOperand(sql, exprSql,
            Precedence.parenthesizeLeft(testExpr.precedence(), Precedence.COMPARISON));
        sql.append(negated ? " NOT IN (" : " IN (");
        sql.append(valuesSql);
        sql.append(")");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return negated == that.negated &&
               Objects.equals(testExpr, that.testExpr) &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }

    @Override
    public String toString() {
        String op = negated ? "NOT IN" : "IN";
        return "InExpression(" + testExpr + " " + op + " " + values.size() + " values)";
    }
}
