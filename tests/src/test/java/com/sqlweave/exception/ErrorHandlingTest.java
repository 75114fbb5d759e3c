package com.sqlweave.exception;

import com.sqlweave.test.TestBase;
import com.sqlweave.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the exception types and their user-facing messages.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Error Handling Tests")
public class ErrorHandlingTest extends TestBase {

    private static final class Opaque {
    }

    @Test
    @DisplayName("Unsupported value exception names the type")
    void testForValue() {
        UnsupportedValueException e = UnsupportedValueException.forValue(new Opaque());

        assertThat(e).isInstanceOf(SQLGenerationException.class);
        assertThat(e.getMessage()).isEqualTo("unsupported type " + Opaque.class.getName());
        assertThat(e.getFailedType()).isEqualTo(Opaque.class);
    }

    @Test
    @DisplayName("User message for a failed type")
    void testUserMessageWithType() {
        UnsupportedValueException e = UnsupportedValueException.forValue(new Opaque());

        assertThat(e.getUserMessage())
            .startsWith("Cannot build this query: values of type Opaque cannot be written as SQL")
            .contains("TextualValue");
    }

    @Test
    @DisplayName("User message without a failed type")
    void testUserMessageWithoutType() {
        SQLGenerationException e = new SQLGenerationException("empty column list");

        assertThat(e.getFailedType()).isNull();
        assertThat(e.getUserMessage()).isEqualTo("Cannot build this query: empty column list");
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("inner");
        SQLGenerationException e = new SQLGenerationException("outer", cause, UUID.class);

        assertThat(e).hasCause(cause).hasMessage("outer");
        assertThat(e.getFailedType()).isEqualTo(UUID.class);
    }

    @Test
    @DisplayName("Rendering failures are unchecked")
    void testUnchecked() {
        assertThat(RuntimeException.class).isAssignableFrom(SQLGenerationException.class);
        assertThatThrownBy(() -> sql(col("id").equalTo(new Opaque())))
            .isInstanceOf(UnsupportedValueException.class)
            .hasMessageContaining("Opaque");
    }
}
