package com.sqlweave.expression;

import com.sqlweave.generator.ValueFlattener;
import com.sqlweave.statement.SelectFinal;

import java.util.List;

/**
 * Builds operator nodes and applies the boolean short-circuit rules.
 *
 * <p>Folding is limited to the absorbing and identity constants:
 * <ul>
 *   <li>{@code false AND x} is {@code false}; {@code true AND p} is {@code p}</li>
 *   <li>{@code true OR x} is {@code true}; {@code false OR p} is {@code p}</li>
 *   <li>{@code NOT true} is {@code false}; {@code NOT false} is {@code true}</li>
 *   <li>{@code x IN ()} is {@code false}; {@code x NOT IN ()} is {@code true}</li>
 * </ul>
 * The identity rules only apply when {@code p} is itself classified as
 * boolean; otherwise the generic operator is built. IN and BETWEEN
 * predicates, including a single-value IN written as {@code =}, are not
 * classified as boolean.
 */
final class OperatorCompiler {

    private OperatorCompiler() {}

    static BinaryExpression binary(Expression left, String operator, Object right, int precedence,
                                   boolean booleanTyped) {
        return new BinaryExpression(left, operator, right, precedence, booleanTyped);
    }

    static UnaryExpression prefix(Expression operand, String prefix, int precedence, boolean booleanTyped) {
        return new UnaryExpression(operand, prefix, "", precedence, booleanTyped);
    }

    static UnaryExpression suffix(Expression operand, String suffix, int precedence, boolean booleanTyped) {
        return new UnaryExpression(operand, "", suffix, precedence, booleanTyped);
    }

    static BooleanExpression and(BooleanExpression left, Object right) {
        if (left.isDefinitelyFalse()) {
            return left;
        }
        if (left.isDefinitelyTrue()) {
            BooleanExpression folded = asBoolean(right);
            if (folded != null) {
                return folded;
            }
        }
        return binary(left, "AND", right, Precedence.AND, true);
    }

    static BooleanExpression or(BooleanExpression left, Object right) {
        if (left.isDefinitelyTrue()) {
            return left;
        }
        if (left.isDefinitelyFalse()) {
            BooleanExpression folded = asBoolean(right);
            if (folded != null) {
                return folded;
            }
        }
        return binary(left, "OR", right, Precedence.OR, true);
    }

    static BooleanExpression not(BooleanExpression operand) {
        if (operand.isDefinitelyTrue()) {
            return Literal.alwaysFalse();
        }
        if (operand.isDefinitelyFalse()) {
            return Literal.alwaysTrue();
        }
        return prefix(operand, "NOT ", Precedence.NOT, true);
    }

    static BooleanExpression in(Expression expr, boolean negated, Object[] values) {
        List<Object> flattened = ValueFlattener.flatten(values);
        if (flattened.isEmpty()) {
            return negated ? Literal.alwaysTrue() : Literal.alwaysFalse();
        }
        if (flattened.size() == 1 && !(flattened.get(0) instanceof SelectFinal)) {
            // renders as a comparison but, like IN, is not folded by AND/OR
            return binary(expr, negated ? "<>" : "=", flattened.get(0), Precedence.COMPARISON, false);
        }
        return new InExpression(expr, flattened, negated);
    }

    static BooleanExpression between(Expression expr, Object min, Object max, boolean negated) {
        return new BetweenExpression(expr, min, max, negated);
    }

    /**
     * Reinterprets a value as a boolean expression when it is recognized as
     * one: a boolean constant or a boolean-typed expression. The SQL text is
     * unchanged.
     *
     * @return the boolean view, or null if the value is not recognized
     */
    private static BooleanExpression asBoolean(Object value) {
        if (!(value instanceof Expression expr)) {
            return null;
        }
        if (expr.isDefinitelyTrue()) {
            return Literal.alwaysTrue();
        }
        if (expr.isDefinitelyFalse()) {
            return Literal.alwaysFalse();
        }
        if (!expr.isBooleanTyped()) {
            return null;
        }
        if (expr instanceof BooleanExpression bool) {
            return bool;
        }
        // same text and precedence, typed as boolean
        return new UnaryExpression(expr, "", "", expr.precedence(), true);
    }
}
