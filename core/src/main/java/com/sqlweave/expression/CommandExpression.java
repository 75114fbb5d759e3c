package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Space separated sequence of marshalled items, used by statement builders
 * for keyword runs such as {@code INTERVAL 1 DAY} or
 * {@code ON DUPLICATE KEY UPDATE `a` = 1}.
 *
 * <p>Keywords must be passed as raw fragments; plain strings are quoted like
 * any other value.
 */
public final class CommandExpression implements UnknownExpression {

    private final List<Object> items;

    public CommandExpression(List<?> items) {
        this.items = new ArrayList<>(Objects.requireNonNull(items, "items must not be null"));
    }

    public List<Object> items() {
        return Collections.unmodifiableList(items);
    }

    @Override
    public int precedence() {
        return Precedence.NONE;
    }

    @Override
    public String toSQL(Scope scope) {
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sql.append(' ');
            }
            sql.append(ValueMarshaller.marshal(scope, items.get(i)).sql());
        }
        return sql.toString();
    }

    @Override
    public String toString() {
        return "Command(" + items.size() + " items)";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CommandExpression)) return false;
        return items.equals(((CommandExpression) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }
}
