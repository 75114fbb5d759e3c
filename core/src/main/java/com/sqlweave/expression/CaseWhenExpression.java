package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a closed CASE WHEN expression.
 *
 * <p>SQL form:
 * <pre>
 *   CASE WHEN condition1 THEN result1 WHEN condition2 THEN result2 ELSE default_result END
 * </pre>
 *
 * <p>{@code CASE ... END} delimits itself, so the expression reports
 * {@link Precedence#NONE} and is never parenthesized as an operand.
 */
public final class CaseWhenExpression implements UnknownExpression {

    private final List<Object> conditions;
    private final List<Object> results;
    private final Object elseResult;
    private final boolean hasElse;

    /**
     * Creates a CASE WHEN expression.
     *
     * @param conditions the WHEN conditions (must match results size)
     * @param results the THEN result values
     * @param elseResult the ELSE result value (ignored unless hasElse)
     * @param hasElse whether an ELSE branch is rendered
     * @throws IllegalArgumentException if the lists differ in size or are empty
     */
    public CaseWhenExpression(List<Object> conditions, List<Object> results, Object elseResult, boolean hasElse) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(results, "results must not be null");

        if (conditions.size() != results.size()) {
            throw new IllegalArgumentException(
                "conditions and results must have the same size: " +
                conditions.size() + " vs " + results.size());
        }
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("CASE WHEN requires at least one condition");
        }

        this.conditions = new ArrayList<>(conditions);
        this.results = new ArrayList<>(results);
        this.elseResult = elseResult;
        this.hasElse = hasElse;
    }

    public List<Object> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    public List<Object> results() {
        return Collections.unmodifiableList(results);
    }

    public boolean hasElse() {
        return hasElse;
    }

    @Override
    public int precedence() {
        return Precedence.NONE;
    }

    @Override
    public String toSQL(Scope scope) {
        StringBuilder sql = new StringBuilder("CASE ");

        for (int i = 0; i < conditions.size(); i++) {
            sql.append("WHEN ").append(ValueMarshaller.marshal(scope, conditions.get(i)).sql());
            sql.append(" THEN ").append(ValueMarshaller.marshal(scope, results.get(i)).sql()).append(" ");
        }

        if (hasElse) {
            sql.append("ELSE ").append(ValueMarshaller.marshal(scope, elseResult).sql()).append(" ");
        }

        sql.append("END");
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CaseWhenExpression)) return false;
        CaseWhenExpression that = (CaseWhenExpression) obj;
        return hasElse == that.hasElse &&
               conditions.equals(that.conditions) &&
               results.equals(that.results) &&
               Objects.equals(elseResult, that.elseResult);
    }

    @Override
    public int hashCode() {
        return Objects.hash(conditions, results, elseResult, hasElse);
    }

    @Override
    public String toString() {
        return "CaseWhenExpression(" + conditions.size() + " branches" + (hasElse ? ", else" : "") + ")";
    }
}
