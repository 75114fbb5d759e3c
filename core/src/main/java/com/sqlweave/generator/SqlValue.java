package com.sqlweave.generator;

import com.sqlweave.config.RenderSettings;
import com.sqlweave.exception.UnsupportedValueException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Closed classification of plain host values (everything that is not an
 * expression, statement, table or other collaborator).
 *
 * <p>{@link #classify(Object)} maps a runtime value onto exactly one variant:
 * <ul>
 *   <li>{@link Null} - null</li>
 *   <li>{@link Bool} - {@code Boolean}, rendered {@code 1}/{@code 0}</li>
 *   <li>{@link Integral} - integral numbers of any width</li>
 *   <li>{@link Floating} - {@code Float}, {@code Double}, {@code BigDecimal}</li>
 *   <li>{@link Text} - strings and string-like values, including {@link TextualValue}</li>
 *   <li>{@link Timestamp} - date/time values, normalized to a local date-time</li>
 *   <li>{@link Sequence} - arrays and iterables</li>
 * </ul>
 */
public sealed interface SqlValue
    permits SqlValue.Null, SqlValue.Bool, SqlValue.Integral, SqlValue.Floating,
            SqlValue.Text, SqlValue.Timestamp, SqlValue.Sequence {

    Null NULL = new Null();

    record Null() implements SqlValue {}

    record Bool(boolean value) implements SqlValue {}

    record Integral(Number value) implements SqlValue {}

    record Floating(Number value) implements SqlValue {}

    record Text(String value) implements SqlValue {}

    record Timestamp(LocalDateTime value) implements SqlValue {}

    /**
     * @param elements the elements, still unmarshalled; may contain nested
     *                 expressions, so they are rendered against a scope
     */
    record Sequence(List<Object> elements) implements SqlValue {}

    /**
     * Classifies a host value.
     *
     * @param value the value (may be null)
     * @return the variant
     * @throws UnsupportedValueException if the value matches no variant
     */
    static SqlValue classify(Object value) {
        if (value == null) {
            return NULL;
        }

        LocalDateTime timestamp = toLocalDateTime(value);
        if (timestamp != null) {
            return new Timestamp(timestamp);
        }

        if (value instanceof Boolean b) {
            return new Bool(b);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer ||
            value instanceof Long || value instanceof BigInteger ||
            value instanceof AtomicInteger || value instanceof AtomicLong) {
            return new Integral((Number) value);
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return new Floating((Number) value);
        }
        if (value instanceof CharSequence || value instanceof Character || value instanceof UUID) {
            return new Text(value.toString());
        }
        if (value instanceof Enum<?> e) {
            return new Text(e.name());
        }

        // a single-segment Path iterates over itself
        if (value instanceof Path) {
            throw UnsupportedValueException.forValue(value);
        }
        if (value instanceof Iterable<?> iterable) {
            List<Object> elements = new ArrayList<>();
            for (Object element : iterable) {
                elements.add(element);
            }
            return new Sequence(Collections.unmodifiableList(elements));
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(Array.get(value, i));
            }
            return new Sequence(Collections.unmodifiableList(elements));
        }

        if (value instanceof TextualValue textual) {
            return new Text(textual.toSqlText());
        }

        throw UnsupportedValueException.forValue(value);
    }

    /**
     * Normalizes the supported date/time types to a local date-time.
     * Zone-less instants are converted in the configured time zone.
     *
     * @return the local date-time, or null if the value is not a date/time type
     */
    private static LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime ldt) {
            return ldt;
        }
        if (value instanceof LocalDate date) {
            return date.atStartOfDay();
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, RenderSettings.getTimeZone());
        }
        if (value instanceof java.sql.Timestamp ts) {
            return LocalDateTime.ofInstant(ts.toInstant(), RenderSettings.getTimeZone());
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().atStartOfDay();
        }
        if (value instanceof java.util.Date date) {
            // java.sql.Time does not support toInstant()
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(date.getTime()), RenderSettings.getTimeZone());
        }
        return null;
    }
}
