package com.sqlweave.expression;

import com.sqlweave.generator.MarshalledValue;
import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Expression representing a binary operation.
 *
 * <p>The left operand is an expression; the right operand is any value the
 * marshaller accepts. Operands are parenthesized by precedence only:
 * <pre>
 *   a.add(b).mul(c)     -- (a + b) * c
 *   a.mul(b).add(c)     -- a * b + c
 *   a.sub(b.sub(c))     -- a - (b - c)
 *   a.sub(b).sub(c)     -- a - b - c
 * </pre>
 *
 * @see Precedence#parenthesizeLeft(int, int)
 * @see Precedence#parenthesizeRight(int, int)
 */
public final class BinaryExpression implements UnknownExpression {

    private final Expression left;
    private final String operator;
    private final Object right;
    private final int precedence;
    private final boolean booleanTyped;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator token, e.g. "+" or "AND"
     * @param right the right operand value (may be null)
     * @param precedence the operator's precedence
     * @param booleanTyped whether the operator yields a boolean
     */
    public BinaryExpression(Expression left, String operator, Object right, int precedence,
                            boolean booleanTyped) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = right;
        this.precedence = precedence;
        this.booleanTyped = booleanTyped;
    }

    public Expression left() {
        return left;
    }

    public String operator() {
        return operator;
    }

    public Object right() {
        return right;
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
        String leftSql = left.toSQL(scope);
        MarshalledValue rightValue = ValueMarshaller.marshal(scope, right);

        boolean parenthesizeLeft = Precedence.parenthesizeLeft(left.precedence(), precedence);
        boolean parenthesizeRight = Precedence.parenthesizeRight(rightValue.precedence(), precedence);

        StringBuilder sb = new StringBuilder(leftSql.length() + operator.length() + rightValue.sql().length() + 6);
        appendOperand(sb, leftSql, parenthesizeLeft);
        sb.append(' ').append(operator).append(' ');
        appendOperand(sb, rightValue.sql(), parenthesizeRight);
        return sb.toString();
    }

    static void appendOperand(StringBuilder sb, String sql, boolean parenthesize) {
        if (parenthesize) {
            sb.append('(').append(sql).append(')');
        } else {
            sb.append(sql);
        }
    }

    @Override
    public String toString() {
        return "BinaryExpression(" + left + " " + operator + " " + right + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return precedence == that.precedence &&
               booleanTyped == that.booleanTyped &&
               left.equals(that.left) &&
               operator.equals(that.operator) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right, precedence, booleanTyped);
    }
}
