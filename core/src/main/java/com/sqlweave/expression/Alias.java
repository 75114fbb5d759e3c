package com.sqlweave.expression;

import com.sqlweave.scope.Scope;

/**
 * An aliased select-list item. Aliases are never operands, so they carry no
 * precedence and offer no operators.
 */
public interface Alias {

    String toSQL(Scope scope);
}
