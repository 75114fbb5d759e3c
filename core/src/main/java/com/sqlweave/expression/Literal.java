package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Expression whose SQL text is fixed when it is built and does not depend on
 * the rendering scope.
 *
 * <p>Literals cover:
 * <ul>
 *   <li>the boolean constants {@code 1} and {@code 0}, flagged as definitely true/false</li>
 *   <li>raw SQL fragments, injected verbatim at {@link Precedence#RAW}</li>
 *   <li>named placeholders such as {@code :id}</li>
 * </ul>
 *
 * <p>A literal is never both definitely true and definitely false.
 */
public final class Literal implements UnknownExpression {

    private static final Literal TRUE = new Literal("1", Precedence.NONE, true, false, true);
    private static final Literal FALSE = new Literal("0", Precedence.NONE, false, true, true);

    private final String sql;
    private final int precedence;
    private final boolean definitelyTrue;
    private final boolean definitelyFalse;
    private final boolean booleanTyped;

    /**
     * Creates a literal.
     *
     * @param sql the SQL text
     * @param precedence the precedence of the text's outermost operator
     * @param definitelyTrue whether the text is the constant true
     * @param definitelyFalse whether the text is the constant false
     * @param booleanTyped whether the text is a boolean value
     * @throws IllegalArgumentException if both true and false flags are set
     */
    public Literal(String sql, int precedence, boolean definitelyTrue, boolean definitelyFalse,
                   boolean booleanTyped) {
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        if (definitelyTrue && definitelyFalse) {
            throw new IllegalArgumentException("a literal cannot be both true and false: " + sql);
        }
        this.precedence = precedence;
        this.definitelyTrue = definitelyTrue;
        this.definitelyFalse = definitelyFalse;
        this.booleanTyped = booleanTyped;
    }

    /**
     * Creates a literal that is not a boolean constant.
     *
     * @param sql the SQL text
     * @param precedence the precedence of the text's outermost operator
     * @param booleanTyped whether the text is a boolean value
     */
    public Literal(String sql, int precedence, boolean booleanTyped) {
        this(sql, precedence, false, false, booleanTyped);
    }

    public static Literal alwaysTrue() {
        return TRUE;
    }

    public static Literal alwaysFalse() {
        return FALSE;
    }

    /**
     * Returns the fixed SQL text.
     *
     * @return the SQL text
     */
    public String sql() {
        return sql;
    }

    @Override
    public String toSQL(Scope scope) {
        return sql;
    }

    @Override
    public int precedence() {
        return precedence;
    }

    @Override
    public boolean isDefinitelyTrue() {
        return definitelyTrue;
    }

    @Override
    public boolean isDefinitelyFalse() {
        return definitelyFalse;
    }

    @Override
    public boolean isBooleanTyped() {
        return booleanTyped;
    }

    @Override
    public String toString() {
        return sql;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return precedence == that.precedence &&
               definitelyTrue == that.definitelyTrue &&
               definitelyFalse == that.definitelyFalse &&
               booleanTyped == that.booleanTyped &&
               sql.equals(that.sql);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, precedence, definitelyTrue, definitelyFalse, booleanTyped);
    }
}
