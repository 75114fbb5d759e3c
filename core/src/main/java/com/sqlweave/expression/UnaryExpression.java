package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Expression representing a prefix or suffix operation on one operand.
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>Arithmetic negation and bit inversion: -a, ~a</li>
 *   <li>Logical negation: NOT a</li>
 *   <li>IS tests: a IS NULL, a IS NOT TRUE, ...</li>
 * </ul>
 *
 * <p>The operand is parenthesized only when it binds looser than the
 * operator, e.g. {@code NOT (a OR b)} but {@code NOT a = 1}.
 */
public final class UnaryExpression implements UnknownExpression {

    private final Expression operand;
    private final String prefix;
    private final String suffix;
    private final int precedence;
    private final boolean booleanTyped;

    /**
     * Creates a unary expression.
     *
     * @param operand the operand
     * @param prefix text written before the operand, e.g. "NOT " (may be empty)
     * @param suffix text written after the operand, e.g. " IS NULL" (may be empty)
     * @param precedence the operator's precedence
     * @param booleanTyped whether the operator yields a boolean
     */
    public UnaryExpression(Expression operand, String prefix, String suffix, int precedence,
                           boolean booleanTyped) {
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.suffix = Objects.requireNonNull(suffix, "suffix must not be null");
        this.precedence = precedence;
        this.booleanTyped = booleanTyped;
    }

    public Expression operand() {
        return operand;
    }

    public String prefix() {
        return prefix;
    }

    public String suffix() {
        return suffix;
    }

    @Override
    public int precedence() {
        return precedence;
    }

    @Override
    public boolean isBooleanTyped() {
        return booleanTyped;
    }

    @Override
    public String toSQL(Scope scope) {
        String operandSql = operand.toSQL(scope);
        StringBuilder sb = new StringBuilder(prefix.length() + operandSql.length() + suffix.length() + 2);
        sb.append(prefix);
        BinaryExpression.appendOperand(sb, operandSql, Precedence.parenthesizeLeft(operand.precedence(), precedence));
        sb.append(suffix);
        return sb.toString();
    }

    @Override
    public String toString() {
        return "UnaryExpression(" + prefix + operand + suffix + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return precedence == that.precedence &&
               booleanTyped == that.booleanTyped &&
               operand.equals(that.operand) &&
               prefix.equals(that.prefix) &&
               suffix.equals(that.suffix);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operand, prefix, suffix, precedence, booleanTyped);
    }
}
