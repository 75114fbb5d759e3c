package com.sqlweave.generator;

import com.sqlweave.config.RenderSettings;
import com.sqlweave.exception.UnsupportedValueException;
import com.sqlweave.expression.Expressions;
import com.sqlweave.scope.Dialect;
import com.sqlweave.statement.FieldAssignment;
import com.sqlweave.statement.SelectFinal;
import com.sqlweave.statement.UpdateFinal;
import com.sqlweave.test.TestBase;
import com.sqlweave.test.TestCategories;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for host value marshalling.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Value Marshaller Tests")
public class ValueMarshallerTest extends TestBase {

    private static final Instant NOON_UTC = Instant.parse("2024-03-15T12:30:45Z");

    @BeforeEach
    void useUtc() {
        RenderSettings.configure(Dialect.MYSQL, ZoneOffset.UTC);
    }

    @AfterEach
    void restoreUtc() {
        RenderSettings.configure(Dialect.MYSQL, ZoneOffset.UTC);
    }

    private String marshal(Object value) {
        return ValueMarshaller.marshal(scope, value).sql();
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        @DisplayName("Null and empty Optional")
        void testNull() {
            assertThat(ValueMarshaller.marshal(scope, null)).isEqualTo(MarshalledValue.NULL);
            assertThat(marshal(Optional.empty())).isEqualTo("NULL");
            assertThat(marshal(Optional.of(Optional.empty()))).isEqualTo("NULL");
            assertThat(marshal(Optional.of(Optional.of(Optional.empty())))).isEqualTo("NULL");
            assertThat(ValueMarshaller.marshal(scope, Optional.of(Optional.empty()))).isEqualTo(MarshalledValue.NULL);
            assertThat(MarshalledValue.NULL.precedence()).isZero();
        }

        @Test
        @DisplayName("Present Optional is unwrapped")
        void testOptional() {
            assertThat(marshal(Optional.of(5))).isEqualTo("5");
            assertThat(marshal(Optional.of("x"))).isEqualTo("'x'");
        }

        @Test
        @DisplayName("Booleans render as 1 and 0")
        void testBooleans() {
            assertThat(marshal(true)).isEqualTo("1");
            assertThat(marshal(false)).isEqualTo("0");
        }

        @Test
        @DisplayName("Integral numbers of any width")
        void testIntegral() {
            assertThat(marshal(42)).isEqualTo("42");
            assertThat(marshal(-7)).isEqualTo("-7");
            assertThat(marshal((byte) 3)).isEqualTo("3");
            assertThat(marshal((short) -3)).isEqualTo("-3");
            assertThat(marshal(Long.MAX_VALUE)).isEqualTo("9223372036854775807");
            assertThat(marshal(Long.MIN_VALUE)).isEqualTo("-9223372036854775808");
            assertThat(marshal(new BigInteger("123456789012345678901234567890")))
                .isEqualTo("123456789012345678901234567890");
            assertThat(marshal(new AtomicLong(5))).isEqualTo("5");
        }

        @Test
        @DisplayName("Decimals keep their scale")
        void testBigDecimal() {
            assertThat(marshal(new BigDecimal("12.50"))).isEqualTo("12.50");
            assertThat(marshal(new BigDecimal("1E+3"))).isEqualTo("1000");
            assertThat(marshal(new BigDecimal("-0.001"))).isEqualTo("-0.001");
        }

        @Test
        @DisplayName("Strings and string-like values are quoted")
        void testText() {
            assertThat(marshal("abc")).isEqualTo("'abc'");
            assertThat(marshal("")).isEqualTo("''");
            assertThat(marshal("it's")).isEqualTo("'it\\'s'");
            assertThat(marshal('x')).isEqualTo("'x'");
            assertThat(marshal(new StringBuilder("sb"))).isEqualTo("'sb'");
            assertThat(marshal(UUID.fromString("123e4567-e89b-12d3-a456-426614174000")))
                .isEqualTo("'123e4567-e89b-12d3-a456-426614174000'");
        }

        @Test
        @DisplayName("Enums render by name")
        void testEnum() {
            assertThat(marshal(DayOfWeek.MONDAY)).isEqualTo("'MONDAY'");
        }

        @Test
        @DisplayName("Textual values render their text, escaped")
        void testTextualValue() {
            TextualValue plain = () -> "custom";
            TextualValue quoted = () -> "it's";

            assertThat(marshal(plain)).isEqualTo("'custom'");
            assertThat(marshal(quoted)).isEqualTo("'it\\'s'");
        }
    }

    @Nested
    @DisplayName("Floating Point")
    class FloatingPoint {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "2.5,        2.5",
            "3.0,        3",
            "0.1,        0.1",
            "-0.5,       -0.5",
            "0.001,      0.001",
            "0.0001,     1e-4",
            "1.0E-7,     1e-7",
            "1.0E7,      1e7",
            "1.5E300,    1.5e300",
            "123456.789, 123456.789",
            "0.0,        0"
        })
        @DisplayName("Shortest representation with trimmed integral values")
        void testDoubles(double input, String expected) {
            assertThat(marshal(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Floats use their own shortest representation")
        void testFloats() {
            assertThat(marshal(0.1f)).isEqualTo("0.1");
            assertThat(marshal(2.0f)).isEqualTo("2");
            assertThat(marshal(1.25f)).isEqualTo("1.25");
        }

        @Test
        @DisplayName("Non-finite values are unsupported")
        void testNonFinite() {
            assertThatThrownBy(() -> marshal(Double.NaN)).isInstanceOf(UnsupportedValueException.class);
            assertThatThrownBy(() -> marshal(Double.POSITIVE_INFINITY)).isInstanceOf(UnsupportedValueException.class);
            assertThatThrownBy(() -> marshal(Float.NEGATIVE_INFINITY)).isInstanceOf(UnsupportedValueException.class);
        }

        @Test
        @DisplayName("Formatted doubles read back to the same value")
        void testRoundTrip() {
            Random random = new Random(7);
            for (int i = 0; i < 1000; i++) {
                double d = Double.longBitsToDouble(random.nextLong());
                if (Double.isNaN(d) || Double.isInfinite(d)) {
                    continue;
                }
                String text = ValueMarshaller.formatFloating(d);
                assertThat(Double.parseDouble(text)).as(text).isEqualTo(d);
            }
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class Timestamps {

        @Test
        @DisplayName("Local date-time with six fractional digits")
        void testLocalDateTime() {
            assertThat(marshal(LocalDateTime.of(2024, 3, 15, 10, 30, 45, 123456789)))
                .isEqualTo("'2024-03-15 10:30:45.123456'");
            assertThat(marshal(LocalDateTime.of(2024, 3, 15, 10, 30)))
                .isEqualTo("'2024-03-15 10:30:00.000000'");
        }

        @Test
        @DisplayName("Years outside 1..9999 keep their proleptic value")
        void testYearBoundaries() {
            assertThat(marshal(LocalDateTime.of(0, 1, 1, 0, 0))).isEqualTo("'0000-01-01 00:00:00.000000'");
            assertThat(marshal(LocalDateTime.of(10000, 1, 1, 0, 0))).isEqualTo("'10000-01-01 00:00:00.000000'");
            assertThat(marshal(LocalDateTime.of(-5, 6, 1, 0, 0))).isEqualTo("'-0005-06-01 00:00:00.000000'");
            assertThat(marshal(LocalDate.of(999, 12, 31))).isEqualTo("'0999-12-31 00:00:00.000000'");
        }

        @Test
        @DisplayName("Dates render at midnight")
        void testDates() {
            assertThat(marshal(LocalDate.of(2024, 3, 15))).isEqualTo("'2024-03-15 00:00:00.000000'");
            assertThat(marshal(java.sql.Date.valueOf("2024-03-15"))).isEqualTo("'2024-03-15 00:00:00.000000'");
        }

        @Test
        @DisplayName("Zoned values keep their wall clock")
        void testZonedValues() {
            assertThat(marshal(OffsetDateTime.of(2024, 3, 15, 10, 30, 45, 0, ZoneOffset.ofHours(2))))
                .isEqualTo("'2024-03-15 10:30:45.000000'");
            assertThat(marshal(ZonedDateTime.of(2024, 3, 15, 10, 30, 45, 0, ZoneId.of("America/New_York"))))
                .isEqualTo("'2024-03-15 10:30:45.000000'");
        }

        @Test
        @DisplayName("Instants use the configured zone")
        void testInstants() {
            assertThat(marshal(NOON_UTC)).isEqualTo("'2024-03-15 12:30:45.000000'");
            assertThat(marshal(java.sql.Timestamp.from(NOON_UTC))).isEqualTo("'2024-03-15 12:30:45.000000'");
            assertThat(marshal(java.util.Date.from(NOON_UTC))).isEqualTo("'2024-03-15 12:30:45.000000'");

            RenderSettings.configure(Dialect.MYSQL, ZoneId.of("Asia/Tokyo"));

            assertThat(marshal(NOON_UTC)).isEqualTo("'2024-03-15 21:30:45.000000'");
        }
    }

    @Nested
    @DisplayName("Sequences")
    class Sequences {

        @Test
        @DisplayName("Lists and arrays render parenthesized")
        void testSequences() {
            assertThat(marshal(List.of(1, "a"))).isEqualTo("(1, 'a')");
            assertThat(marshal(new int[] {1, 2})).isEqualTo("(1, 2)");
            assertThat(marshal(new String[] {"x"})).isEqualTo("('x')");
            assertThat(marshal(Arrays.asList(1, null))).isEqualTo("(1, NULL)");
        }

        @Test
        @DisplayName("Nested sequences nest their parentheses")
        void testNested() {
            assertThat(marshal(List.of(List.of(1, 2), 3))).isEqualTo("((1, 2), 3)");
        }

        @Test
        @DisplayName("A shared sublist may appear more than once")
        void testSharedSublist() {
            List<Integer> inner = List.of(1);

            assertThat(marshal(List.of(inner, inner))).isEqualTo("((1), (1))");
            assertThat(marshal(new Object[] {inner, List.of(inner)})).isEqualTo("((1), ((1)))");
        }

        @Test
        @DisplayName("Empty sequence")
        void testEmpty() {
            assertThat(marshal(List.of())).isEqualTo("()");
        }

        @Test
        @DisplayName("Comma values leave elements unparenthesized")
        void testCommaValues() {
            assertThat(ValueMarshaller.commaValues(scope, Arrays.asList(1, "a", null, col("age").add(1))))
                .isEqualTo("1, 'a', NULL, `age` + 1");
        }
    }

    @Nested
    @DisplayName("Collaborators")
    class Collaborators {

        @Test
        @DisplayName("Expressions keep their precedence")
        void testExpression() {
            MarshalledValue value = ValueMarshaller.marshal(scope, col("age").add(1));

            assertThat(value.sql()).isEqualTo("`age` + 1");
            assertThat(value.precedence()).isEqualTo(7);
            assertThat(ValueMarshaller.marshal(scope, Expressions.raw("x")).precedence()).isEqualTo(99);
        }

        @Test
        @DisplayName("Assignments render their own text")
        void testAssignment() {
            assertThat(marshal(new FieldAssignment(col("name"), "x"))).isEqualTo("`name` = 'x'");
        }

        @Test
        @DisplayName("Selects are parenthesized, updates are not")
        void testStatements() {
            SelectFinal select = () -> "SELECT 1";
            UpdateFinal update = () -> "UPDATE `users` SET `age` = 1";

            assertThat(ValueMarshaller.marshal(scope, select)).isEqualTo(MarshalledValue.of("(SELECT 1)"));
            assertThat(marshal(update)).isEqualTo("UPDATE `users` SET `age` = 1");
        }

        @Test
        @DisplayName("Tables render their referenced name")
        void testTable() {
            assertThat(marshal(USERS)).isEqualTo("`users`");
            assertThat(marshal(USERS.as("u"))).isEqualTo("`u`");
        }

        @Test
        @DisplayName("CASE builders are closed")
        void testCaseBuilder() {
            assertThat(marshal(Expressions.caseWhen(col("age").isNull(), 0)))
                .isEqualTo("CASE WHEN `age` IS NULL THEN 0 END");
        }

        @Test
        @DisplayName("Renderable detection")
        void testIsRenderable() {
            assertThat(ValueMarshaller.isRenderable(col("age"))).isTrue();
            assertThat(ValueMarshaller.isRenderable(USERS)).isTrue();
            assertThat(ValueMarshaller.isRenderable((SelectFinal) () -> "SELECT 1")).isTrue();
            assertThat(ValueMarshaller.isRenderable("text")).isFalse();
            assertThat(ValueMarshaller.isRenderable(List.of())).isFalse();
        }
    }

    @Nested
    @DisplayName("Unsupported Values")
    class Unsupported {

        @Test
        @DisplayName("Unknown types name their class")
        void testUnknownType() {
            assertThatThrownBy(() -> marshal(new Object()))
                .isInstanceOf(UnsupportedValueException.class)
                .hasMessage("unsupported type java.lang.Object")
                .extracting(e -> ((UnsupportedValueException) e).getFailedType())
                .isEqualTo(Object.class);
        }

        @Test
        @DisplayName("Paths are not sequences")
        void testPath() {
            assertThatThrownBy(() -> marshal(Path.of("a")))
                .isInstanceOf(UnsupportedValueException.class);
        }

        @Test
        @DisplayName("Failures inside sequences propagate")
        void testNestedFailure() {
            assertThatThrownBy(() -> marshal(List.of(1, new Object())))
                .isInstanceOf(UnsupportedValueException.class);
            assertThatThrownBy(() -> marshal(Optional.of(new Object())))
                .isInstanceOf(UnsupportedValueException.class);
        }

        @Test
        @DisplayName("Self-containing sequences are rejected")
        void testSelfContaining() {
            List<Object> list = new ArrayList<>(List.of(1));
            list.add(list);
            Object[] array = new Object[2];
            array[0] = 1;
            array[1] = List.of(2, array);

            assertThatThrownBy(() -> marshal(list))
                .isInstanceOf(UnsupportedValueException.class)
                .hasMessage("self-referencing sequence java.util.ArrayList")
                .extracting(e -> ((UnsupportedValueException) e).getFailedType())
                .isEqualTo(ArrayList.class);
            assertThatThrownBy(() -> marshal(array))
                .isInstanceOf(UnsupportedValueException.class)
                .hasMessageContaining("self-referencing sequence");
        }
    }
}
