package com.sqlweave.expression;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Static factory methods for building expressions.
 *
 * <p>Example usage:
 * <pre>
 *   BooleanExpression where = Expressions.and(
 *       users.column("age").greaterThanOrEqualTo(18),
 *       users.column("name").like("A%"));
 *   String sql = where.toSQL(scope);   // `age` &gt;= 18 AND `name` LIKE 'A%'
 * </pre>
 */
public final class Expressions {

    private static final Pattern PLACEHOLDER_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private Expressions() {}

    /**
     * Returns the constant true, rendered {@code 1}.
     *
     * @return the constant
     */
    public static BooleanExpression alwaysTrue() {
        return Literal.alwaysTrue();
    }

    /**
     * Returns the constant false, rendered {@code 0}.
     *
     * @return the constant
     */
    public static BooleanExpression alwaysFalse() {
        return Literal.alwaysFalse();
    }

    /**
     * Injects a raw SQL fragment verbatim. The fragment binds loosest of all,
     * so it is parenthesized by any operator it becomes an operand of.
     *
     * @param sql the SQL text
     * @return the expression
     */
    public static UnknownExpression raw(String sql) {
        return new Literal(sql, Precedence.RAW, false);
    }

    /**
     * Creates a named parameter placeholder, rendered {@code :name}.
     *
     * @param name the parameter name
     * @return the expression
     * @throws IllegalArgumentException if the name is not a valid identifier
     */
    public static UnknownExpression placeholder(String name) {
        if (name == null || !PLACEHOLDER_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid placeholder name: " + name);
        }
        return new Literal(":" + name, Precedence.NONE, false);
    }

    /**
     * Wraps a host value so that operators can be applied to it.
     *
     * @param value the value (may be null)
     * @return the expression
     */
    public static UnknownExpression value(Object value) {
        return new ValueExpression(value);
    }

    /**
     * Combines conditions with AND, folding boolean constants.
     *
     * @param conditions the conditions
     * @return the constant true when there are no conditions
     */
    public static BooleanExpression and(BooleanExpression... conditions) {
        if (conditions.length == 0) {
            return alwaysTrue();
        }
        BooleanExpression result = conditions[0];
        for (int i = 1; i < conditions.length; i++) {
            result = result.and(conditions[i]);
        }
        return result;
    }

    /**
     * Combines conditions with OR, folding boolean constants.
     *
     * @param conditions the conditions
     * @return the constant false when there are no conditions
     */
    public static BooleanExpression or(BooleanExpression... conditions) {
        if (conditions.length == 0) {
            return alwaysFalse();
        }
        BooleanExpression result = conditions[0];
        for (int i = 1; i < conditions.length; i++) {
            result = result.or(conditions[i]);
        }
        return result;
    }

    /**
     * Calls a function. Arguments are marshalled independently.
     *
     * @param name the function name
     * @param args the arguments
     * @return the expression
     */
    public static UnknownExpression function(String name, Object... args) {
        return new FunctionCall(name, Arrays.asList(args));
    }

    public static UnknownExpression ifThenElse(Object predicate, Object trueValue, Object falseValue) {
        return function("IF", predicate, trueValue, falseValue);
    }

    public static StringExpression concat(Object... args) {
        return function("CONCAT", args);
    }

    /**
     * Joins marshalled items with single spaces.
     *
     * @param items the items; keywords should be raw fragments
     * @return the expression
     */
    public static UnknownExpression command(Object... items) {
        return new CommandExpression(Arrays.asList(items));
    }

    /**
     * Starts a searched CASE expression.
     *
     * @param condition the first condition
     * @param result the first result
     * @return the builder
     */
    public static CaseWhen caseWhen(Object condition, Object result) {
        return CaseWhen.EMPTY.when(condition, result);
    }
}
