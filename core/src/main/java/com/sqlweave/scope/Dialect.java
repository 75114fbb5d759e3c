package com.sqlweave.scope;

/**
 * SQL dialects understood by the identifier renderer.
 *
 * <p>Only identifier quoting differs between dialects at this layer; literal
 * escaping is the same for all of them.
 *
 * <ul>
 *   <li>{@code MYSQL} - {@code `name`}</li>
 *   <li>{@code POSTGRES}, {@code SQLITE} - {@code "name"}</li>
 *   <li>{@code MSSQL} - {@code [name]}</li>
 * </ul>
 */
public enum Dialect {
    MYSQL('`', '`'),
    POSTGRES('"', '"'),
    SQLITE('"', '"'),
    MSSQL('[', ']');

    private final char open;
    private final char close;

    Dialect(char open, char close) {
        this.open = open;
        this.close = close;
    }

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>An embedded closing quote character is escaped by doubling it.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String closing = String.valueOf(close);
        return open + identifier.replace(closing, closing + closing) + close;
    }

    /**
     * Parse a dialect name (case-insensitive).
     *
     * @param value "mysql", "postgres", "sqlite" or "mssql"
     * @return the parsed Dialect
     * @throws IllegalArgumentException if value is not recognized
     */
    public static Dialect parse(String value) {
        if (value == null) {
            return MYSQL;
        }
        return switch (value.trim().toLowerCase()) {
            case "mysql"                  -> MYSQL;
            case "postgres", "postgresql" -> POSTGRES;
            case "sqlite", "sqlite3"      -> SQLITE;
            case "mssql", "sqlserver"     -> MSSQL;
            default -> throw new IllegalArgumentException(
                "Unknown SQL dialect: '%s'. Valid values: mysql, postgres, sqlite, mssql".formatted(value));
        };
    }
}
