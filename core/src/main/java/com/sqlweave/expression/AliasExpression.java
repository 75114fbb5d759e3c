package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Gives an alias (name) to an expression in a select list.
 *
 * <p>Examples:
 * <pre>
 *   `price` * `quantity` AS total
 *   SUM(`amount`) AS total_amount
 * </pre>
 *
 * <p>The alias is written as given.
 */
public final class AliasExpression implements Alias {

    private final Expression expression;
    private final String alias;

    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("alias must not be blank");
        }
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toSQL(Scope scope) {
        return expression.toSQL(scope) + " AS " + alias;
    }

    @Override
    public String toString() {
        return "AliasExpression(" + expression + " AS " + alias + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return expression.equals(that.expression) && alias.equals(that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
