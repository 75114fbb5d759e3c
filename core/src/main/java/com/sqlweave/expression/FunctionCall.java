package com.sqlweave.expression;

import com.sqlweave.generator.ValueMarshaller;
import com.sqlweave.scope.Scope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a function or aggregate call.
 *
 * <p>Examples:
 * <pre>
 *   UPPER(`name`)
 *   IFNULL(`score`, 0)
 *   IF(`age` &gt; 18, 'adult', 'minor')
 *   SUM(`amount`)
 * </pre>
 *
 * <p>Each argument is marshalled independently. The call syntax delimits the
 * arguments, so the call itself never needs parentheses and reports
 * {@link Precedence#NONE}.
 */
public final class FunctionCall implements UnknownExpression {

    private final String functionName;
    private final List<Object> arguments;

    /**
     * Creates a function call expression.
     *
     * @param functionName the function name, written as given
     * @param arguments the argument values (elements may be null)
     */
    public FunctionCall(String functionName, List<?> arguments) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        if (this.functionName.trim().isEmpty()) {
            throw new IllegalArgumentException("functionName must not be empty");
        }
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
    }

    public FunctionCall(String functionName, Object... arguments) {
        this(functionName, Arrays.asList(arguments));
    }

    public String functionName() {
        return functionName;
    }

    /**
     * Returns the function arguments.
     *
     * @return an unmodifiable list of arguments
     */
    public List<Object> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public int precedence() {
        return Precedence.NONE;
    }

    @Override
    public String toSQL(Scope scope) {
        return functionName + "(" + ValueMarshaller.commaValues(scope, arguments) + ")";
    }

    @Override
    public String toString() {
        return "FunctionCall(" + functionName + ", " + arguments.size() + " args)";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) obj;
        return functionName.equals(that.functionName) &&
               arguments.equals(that.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments);
    }
}
