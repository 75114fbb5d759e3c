package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * A host value used as the left operand of an operator, marshalled when the
 * tree is rendered.
 *
 * <pre>
 *   Expressions.value(1).add(2)              -- 1 + 2
 *   Expressions.value("x").in(column)        -- 'x' = `column`
 * </pre>
 */
public final class ValueExpression implements UnknownExpression {

    private final Object value;

    public ValueExpression(Object value) {
        this.value = value;
    }

    public Object value() {
        return value;
    }

    @Override
    public int precedence() {
        return value instanceof Expression expr ? expr.precedence() : Precedence.NONE;
    }

    @Override
    public boolean isDefinitelyTrue() {
        return value instanceof Expression expr && expr.isDefinitelyTrue();
    }

    @Override
    public boolean isDefinitelyFalse() {
        return value instanceof Expression expr && expr.isDefinitelyFalse();
    }

    @Override
    public boolean isBooleanTyped() {
        return value instanceof Boolean || value instanceof Expression expr && expr.isBooleanTyped();
    }

    @Override
    public String toSQL(Scope scope) {
        return ValueMarshaller.marshal(scope, value).sql();
    }

    @Override
    public String toString() {
        return "Value(" + value + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ValueExpression)) return false;
        return Objects.equals(value, ((ValueExpression) obj).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }
}
