package com.sqlweave.scope;

import com.sqlweave.expression.Field;

import java.util.List;

/**
 * A table that expressions and statements resolve names against.
 *
 * <p>Generated table bindings implement this interface; {@link TableDefinition}
 * is a generic implementation built at runtime.
 */
public interface Table {

    /**
     * Returns the table name as declared in the database.
     *
     * @return the table name
     */
    String name();

    /**
     * Returns the table's fields in declaration order.
     *
     * @return the fields
     */
    List<Field> fields();

    /**
     * Renders the name this table is referenced by in the given scope,
     * quoted for the scope's dialect.
     *
     * @param scope the rendering scope
     * @return the SQL text
     */
    String toSQL(Scope scope);
}
