package com.sqlweave.expression;

/**
 * Operator precedence levels. A lower number binds tighter.
 *
 * <pre>
 *    4  - (unary minus), ~ (bit inversion)
 *    6  *, /, DIV, %
 *    7  -, +
 *    8  &lt;&lt;, &gt;&gt;
 *    9  &amp;
 *   10  |
 *   11  =, &lt;&gt;, &lt;, &lt;=, &gt;, &gt;=, IS, LIKE, IN
 *   12  BETWEEN, CASE
 *   13  NOT
 *   14  AND
 *   15  XOR
 *   16  OR
 *   17  = (assignment)
 * </pre>
 *
 * <p>Level 17 has no constant: {@link com.sqlweave.statement.FieldAssignment}
 * is the only operator at that level and is never an operand, so its value
 * side is rendered without parentheses.
 *
 * <p>Atomic fragments (literals, columns, function calls) use {@link #NONE}.
 * Raw fragments use {@link #RAW}, the loosest level, so any enclosing
 * operator parenthesizes them.
 */
public final class Precedence {

    public static final int NONE = 0;
    public static final int UNARY = 4;
    public static final int MULTIPLICATIVE = 6;
    public static final int ADDITIVE = 7;
    public static final int SHIFT = 8;
    public static final int BIT_AND = 9;
    public static final int BIT_OR = 10;
    public static final int COMPARISON = 11;
    public static final int BETWEEN = 12;
    public static final int NOT = 13;
    public static final int AND = 14;
    public static final int XOR = 15;
    public static final int OR = 16;
    public static final int RAW = 99;

    private Precedence() {}

    /**
     * Left operands keep equal-precedence operators bare: {@code (a - b) - c}
     * renders as {@code a - b - c}.
     */
    public static boolean parenthesizeLeft(int operand, int operator) {
        return operand > operator;
    }

    /**
     * Right operands are parenthesized at equal precedence, which keeps
     * operators left-associative: {@code a - (b - c)}.
     */
    public static boolean parenthesizeRight(int operand, int operator) {
        return operand >= operator;
    }
}
