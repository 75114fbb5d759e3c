package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * An ORDER BY item: an expression with an optional {@code DESC}.
 *
 * @param expression the sort key
 * @param descending true for {@code DESC}
 */
public record OrderBy(Expression expression, boolean descending) {

    public OrderBy {
        Objects.requireNonNull(expression, "expression must not be null");
    }

    public String toSQL(Scope scope) {
        String sql = expression.toSQL(scope);
        return descending ? sql + " DESC" : sql;
    }
}
