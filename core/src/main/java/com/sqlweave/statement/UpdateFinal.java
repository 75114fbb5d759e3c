package com.sqlweave.statement;

/**
 * An UPDATE statement that is complete and can be rendered on its own.
 * Embedded verbatim, without parentheses.
 */
@FunctionalInterface
public interface UpdateFinal {

    String toSQL();
}
