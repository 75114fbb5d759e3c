package com.sqlweave.scope;

import com.sqlweave.expression.ColumnReference;
import com.sqlweave.expression.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Runtime table binding: a table name, an optional alias and the ordered list
 * of column names.
 *
 * <p>Examples:
 * <pre>
 *   TableDefinition users = TableDefinition.of("users", "id", "name", "age");
 *   users.column("age").greaterThan(18)        -- `age` &gt; 18
 *   users.as("u").column("id")                 -- `u`.`id` in a multi-table scope
 * </pre>
 */
public final class TableDefinition implements Table {

    private final String name;
    private final String alias;
    private final List<String> columnNames;

    /**
     * Creates a table definition.
     *
     * @param name the table name
     * @param alias the alias (may be null)
     * @param columnNames the column names in declaration order
     * @throws IllegalArgumentException if the name is blank or a column name repeats
     */
    public TableDefinition(String name, String alias, List<String> columnNames) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        Objects.requireNonNull(columnNames, "columnNames must not be null");
        if (columnNames.stream().distinct().count() != columnNames.size()) {
            throw new IllegalArgumentException("duplicate column in table " + name + ": " + columnNames);
        }
        this.alias = alias;
        this.columnNames = new ArrayList<>(columnNames);
    }

    public static TableDefinition of(String name, String... columnNames) {
        return new TableDefinition(name, null, List.of(columnNames));
    }

    /**
     * Returns a copy of this table referenced through an alias.
     *
     * @param alias the alias
     * @return the aliased table
     */
    public TableDefinition as(String alias) {
        return new TableDefinition(name, Objects.requireNonNull(alias, "alias must not be null"), columnNames);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Returns the alias.
     *
     * @return the alias, or null if the table is not aliased
     */
    public String alias() {
        return alias;
    }

    /**
     * Returns the name columns are qualified with: the alias when present,
     * otherwise the table name.
     *
     * @return the reference name
     */
    public String referenceName() {
        return alias != null ? alias : name;
    }

    /**
     * Returns a reference to one of this table's columns.
     *
     * @param columnName the column name
     * @return the column reference
     * @throws IllegalArgumentException if the table has no such column
     */
    public ColumnReference column(String columnName) {
        if (!columnNames.contains(columnName)) {
            throw new IllegalArgumentException("table " + name + " has no column " + columnName);
        }
        return new ColumnReference(this, columnName);
    }

    @Override
    public List<Field> fields() {
        List<Field> fields = new ArrayList<>(columnNames.size());
        for (String columnName : columnNames) {
            fields.add(new ColumnReference(this, columnName));
        }
        return Collections.unmodifiableList(fields);
    }

    @Override
    public String toSQL(Scope scope) {
        return scope.dialect().quoteIdentifier(referenceName());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableDefinition)) return false;
        TableDefinition that = (TableDefinition) obj;
        return name.equals(that.name) &&
               Objects.equals(alias, that.alias) &&
               columnNames.equals(that.columnNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alias, columnNames);
    }

    @Override
    public String toString() {
        return alias != null ? name + " AS " + alias : name;
    }
}
