package com.sqlweave.expression;

import com.sqlweave.statement.CaseExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable builder for searched CASE expressions.
 *
 * <pre>
 *   Expressions.caseWhen(age.lessThan(13), "child")
 *       .when(age.lessThan(20), "teen")
 *       .orElse("adult")
 *       .end()
 *   -- CASE WHEN `age` &lt; 13 THEN 'child' WHEN `age` &lt; 20 THEN 'teen' ELSE 'adult' END
 * </pre>
 *
 * <p>A builder may also be passed directly as an operator operand; it is
 * closed with {@link #end()} when rendered.
 */
public final class CaseWhen implements CaseExpression {

    static final CaseWhen EMPTY = new CaseWhen(List.of(), List.of(), null, false);

    private final List<Object> conditions;
    private final List<Object> results;
    private final Object elseResult;
    private final boolean hasElse;

    private CaseWhen(List<Object> conditions, List<Object> results, Object elseResult, boolean hasElse) {
        this.conditions = conditions;
        this.results = results;
        this.elseResult = elseResult;
        this.hasElse = hasElse;
    }

    /**
     * Adds a {@code WHEN condition THEN result} branch.
     *
     * @param condition the condition
     * @param result the result value (may be null)
     * @return a new builder
     */
    public CaseWhen when(Object condition, Object result) {
        if (condition == null) {
            throw new IllegalArgumentException("CASE condition must not be null");
        }
        List<Object> newConditions = new ArrayList<>(conditions);
        newConditions.add(condition);
        List<Object> newResults = new ArrayList<>(results);
        newResults.add(result);
        return new CaseWhen(newConditions, newResults, elseResult, hasElse);
    }

    /**
     * Sets the {@code ELSE} result.
     *
     * @param result the result value (may be null, rendering {@code ELSE NULL})
     * @return a new builder
     */
    public CaseWhen orElse(Object result) {
        return new CaseWhen(conditions, results, result, true);
    }

    @Override
    public CaseWhenExpression end() {
        return new CaseWhenExpression(conditions, results, elseResult, hasElse);
    }
}
