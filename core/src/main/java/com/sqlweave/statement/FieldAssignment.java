package com.sqlweave.statement;

import com.sqlweave.expression.Field;
import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.Objects;

/**
 * Assignment of a marshalled value to a field.
 *
 * <p>Examples:
 * <pre>
 *   `name` = 'Alice'
 *   `visits` = `visits` + 1
 * </pre>
 *
 * @param field the assigned field
 * @param value the value; any value the marshaller accepts, including null
 */
public record FieldAssignment(Field field, Object value) implements Assignment {

    public FieldAssignment {
        Objects.requireNonNull(field, "field must not be null");
    }

    @Override
    public String toSQL(Scope scope) {
        String valueSql = ValueMarshaller.marshal(scope, value).sql();
        return field.toSQL(scope) + " = " + valueSql;
    }
}
