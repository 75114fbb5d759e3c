package com.sqlweave.expression;

import com.sqlweave.scope.Scope;
import com.sqlweave.scope.Table;

import java.util.Objects;

/**
 * Expression representing a reference to a column.
 *
 * <p>The column name is quoted for the scope's dialect. When the scope holds
 * more than one table, or a join, the name is qualified with the table's
 * rendered reference to stay unambiguous:
 * <pre>
 *   `age`               -- single-table scope
 *   `u`.`age`           -- multi-table scope, table aliased as u
 * </pre>
 */
public final class ColumnReference implements Field {

    private final Table table;
    private final String columnName;

    /**
     * Creates a column reference.
     *
     * @param table the owning table
     * @param columnName the column name
     */
    public ColumnReference(Table table, String columnName) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    @Override
    public String name() {
        return columnName;
    }

    @Override
    public Table table() {
        return table;
    }

    @Override
    public int precedence() {
        return Precedence.NONE;
    }

    @Override
    public String toSQL(Scope scope) {
        String column = scope.dialect().quoteIdentifier(columnName);
        if (scope.isMultiTable()) {
            return table.toSQL(scope) + "." + column;
        }
        return column;
    }

    @Override
    public String toString() {
        return table.name() + "." + columnName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return table.equals(that.table) && columnName.equals(that.columnName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, columnName);
    }
}
