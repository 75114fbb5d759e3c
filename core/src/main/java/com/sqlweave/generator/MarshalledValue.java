package com.sqlweave.generator;

import java.util.Objects;

/**
 * SQL text produced for a host value, with the binding strength of its
 * outermost operator.
 *
 * @param sql the SQL fragment
 * @param precedence the precedence used when the fragment becomes an operand
 */
public record MarshalledValue(String sql, int precedence) {

    public static final MarshalledValue NULL = new MarshalledValue("NULL", 0);

    public MarshalledValue {
        Objects.requireNonNull(sql, "sql must not be null");
    }

    /**
     * Creates a value that never needs parentheses of its own.
     *
     * @param sql the SQL fragment
     * @return the marshalled value
     */
    public static MarshalledValue of(String sql) {
        return new MarshalledValue(sql, 0);
    }
}
