package com.sqlweave.statement;

import com.sqlweave.scope.Scope;

/**
 * A {@code field = value} pair used by INSERT ... ON DUPLICATE KEY UPDATE and
 * UPDATE ... SET clauses.
 */
public interface Assignment {

    /**
     * Renders this assignment.
     *
     * @param scope the rendering scope
     * @return the SQL text
     */
    String toSQL(Scope scope);
}
