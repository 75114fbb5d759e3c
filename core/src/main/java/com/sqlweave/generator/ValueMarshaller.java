package com.sqlweave.generator;

import com.sqlweave.exception.UnsupportedValueException;
import com.sqlweave.expression.Expression;
import com.sqlweave.scope.Scope;
import com.sqlweave.scope.Table;
import com.sqlweave.statement.Assignment;
import com.sqlweave.statement.CaseExpression;
import com.sqlweave.statement.SelectFinal;
import com.sqlweave.statement.UpdateFinal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.SignStyle;
import java.time.temporal.ChronoField;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts arbitrary host values into SQL fragments.
 *
 * <p>Dispatch order:
 * <ol>
 *   <li>null and empty {@link Optional} - {@code NULL}; a present Optional is unwrapped</li>
 *   <li>{@link Expression} - its own rendering and precedence</li>
 *   <li>{@link Assignment} - its rendering</li>
 *   <li>{@link SelectFinal} - its rendering in parentheses</li>
 *   <li>{@link UpdateFinal} - its rendering, verbatim</li>
 *   <li>{@link Table} - its referenced name</li>
 *   <li>{@link CaseExpression} - its closed form</li>
 *   <li>everything else - classified by {@link SqlValue#classify(Object)}</li>
 * </ol>
 *
 * <p>Only expressions report a precedence; every other fragment is either
 * atomic or already parenthesized and reports 0. A sequence that contains
 * itself, directly or through nested sequences, is rejected.
 */
public final class ValueMarshaller {

    private static final Logger logger = LoggerFactory.getLogger(ValueMarshaller.class);

    /**
     * {@code yyyy-MM-dd HH:mm:ss.SSSSSS} over the proleptic year: at least four
     * digits, a minus sign only for negative years and never a plus sign.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4, 10, SignStyle.NORMAL)
        .appendPattern("-MM-dd HH:mm:ss.SSSSSS")
        .toFormatter();

    private ValueMarshaller() {}

    /**
     * Marshals a host value.
     *
     * @param scope the rendering scope
     * @param value the value (may be null)
     * @return the SQL fragment and its precedence
     * @throws UnsupportedValueException if the value has no SQL representation
     */
    public static MarshalledValue marshal(Scope scope, Object value) {
        return marshal(scope, value, null);
    }

    /**
     * @param enclosing the sequences currently being rendered around this
     *                  value, by identity; null at the top level
     */
    private static MarshalledValue marshal(Scope scope, Object value, Set<Object> enclosing) {
        if (value == null) {
            return MarshalledValue.NULL;
        }
        if (value instanceof Optional<?> optional) {
            return optional.isPresent() ? marshal(scope, optional.get(), enclosing) : MarshalledValue.NULL;
        }
        if (value instanceof Expression expr) {
            return new MarshalledValue(expr.toSQL(scope), expr.precedence());
        }
        if (value instanceof Assignment assignment) {
            return MarshalledValue.of(assignment.toSQL(scope));
        }
        if (value instanceof SelectFinal select) {
            return MarshalledValue.of("(" + select.toSQL() + ")");
        }
        if (value instanceof UpdateFinal update) {
            return MarshalledValue.of(update.toSQL());
        }
        if (value instanceof Table table) {
            return MarshalledValue.of(table.toSQL(scope));
        }
        if (value instanceof CaseExpression caseExpr) {
            return MarshalledValue.of(caseExpr.end().toSQL(scope));
        }
        return marshalHostValue(scope, value, classify(value), enclosing);
    }

    /**
     * Renders values as a comma separated list, each marshalled on its own.
     * Individual values are not parenthesized.
     *
     * @param scope the rendering scope
     * @param values the values
     * @return the SQL text
     */
    public static String commaValues(Scope scope, List<?> values) {
        return commaValues(scope, values, null);
    }

    private static String commaValues(Scope scope, List<?> values, Set<Object> enclosing) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(marshal(scope, values.get(i), enclosing).sql());
        }
        return sb.toString();
    }

    /**
     * Returns whether a value is rendered by delegation to a collaborator
     * rather than classified as a plain host value.
     *
     * @param value the value
     * @return true for expressions, assignments, statements, tables and CASE builders
     */
    public static boolean isRenderable(Object value) {
        return value instanceof Expression || value instanceof Assignment ||
               value instanceof SelectFinal || value instanceof UpdateFinal ||
               value instanceof Table || value instanceof CaseExpression;
    }

    private static SqlValue classify(Object value) {
        try {
            return SqlValue.classify(value);
        } catch (UnsupportedValueException e) {
            logger.debug("No SQL representation for value of type {}", value.getClass().getName());
            throw e;
        }
    }

    private static MarshalledValue marshalHostValue(Scope scope, Object hostValue, SqlValue value,
                                                    Set<Object> enclosing) {
        if (value instanceof SqlValue.Sequence sequence) {
            Set<Object> path = enclosing != null ? enclosing : Collections.newSetFromMap(new IdentityHashMap<>());
            if (!path.add(hostValue)) {
                logger.debug("Sequence of type {} contains itself", hostValue.getClass().getName());
                throw new UnsupportedValueException(
                    "self-referencing sequence " + hostValue.getClass().getName(), hostValue.getClass());
            }
            try {
                return MarshalledValue.of("(" + commaValues(scope, sequence.elements(), path) + ")");
            } finally {
                path.remove(hostValue);
            }
        }
        return MarshalledValue.of(literal(value));
    }

    private static String literal(SqlValue value) {
        if (value instanceof SqlValue.Null) {
            return "NULL";
        }
        if (value instanceof SqlValue.Bool bool) {
            return bool.value() ? "1" : "0";
        }
        if (value instanceof SqlValue.Integral integral) {
            return integral.value().toString();
        }
        if (value instanceof SqlValue.Floating floating) {
            return formatFloating(floating.value());
        }
        if (value instanceof SqlValue.Text text) {
            return SQLQuoting.quoteString(text.value());
        }
        if (value instanceof SqlValue.Timestamp timestamp) {
            return SQLQuoting.quoteString(TIMESTAMP_FORMAT.format(timestamp.value()));
        }
        throw new IllegalStateException("Unhandled value variant: " + value);
    }

    /**
     * Formats a floating point number with the shortest decimal text that
     * reads back to the same value. Integral values carry no fraction and the
     * exponent marker is lower-case: {@code 2.5}, {@code 3}, {@code 1e-7}.
     *
     * @param number a Float, Double or BigDecimal
     * @return the SQL text
     * @throws UnsupportedValueException for NaN and infinities
     */
    static String formatFloating(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new UnsupportedValueException("non-finite floating point value " + number, number.getClass());
        }

        String text = number instanceof Float f ? Float.toString(f) : Double.toString(d);
        int exponent = text.indexOf('E');
        String mantissa = exponent < 0 ? text : text.substring(0, exponent);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return exponent < 0 ? mantissa : mantissa + "e" + text.substring(exponent + 1);
    }
}
