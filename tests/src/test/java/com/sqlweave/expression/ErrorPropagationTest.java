package com.sqlweave.expression;

import com.sqlweave.exception.SQLGenerationException;
import com.sqlweave.exception.UnsupportedValueException;
import com.sqlweave.scope.Scope;
import com.sqlweave.test.TestBase;
import com.sqlweave.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sqlweave.expression.Expressions.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests that a failure anywhere in a tree surfaces unchanged from the
 * top-level render.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Expression
@DisplayName("Error Propagation Tests")
public class ErrorPropagationTest extends TestBase {

    private static final SQLGenerationException BOOM = new SQLGenerationException("boom");

    /** An expression whose rendering always fails. */
    private static final UnknownExpression FAILING = new UnknownExpression() {
        @Override
        public String toSQL(Scope scope) {
            throw BOOM;
        }

        @Override
        public int precedence() {
            return Precedence.NONE;
        }
    };

    @Test
    @DisplayName("Unsupported value deep in an arithmetic tree")
    void testNestedUnsupportedValue() {
        NumberExpression tree = col("id").add(new Object()).mul(2);

        assertThatThrownBy(() -> sql(tree))
            .isInstanceOf(UnsupportedValueException.class)
            .hasMessage("unsupported type java.lang.Object");
    }

    @Test
    @DisplayName("Unsupported value in a left operand")
    void testLeftOperand() {
        assertThatThrownBy(() -> sql(value(new Object()).equalTo(1)))
            .isInstanceOf(UnsupportedValueException.class);
    }

    @Test
    @DisplayName("Unsupported value inside a nested list")
    void testNestedList() {
        assertThatThrownBy(() -> sql(col("id").equalTo(List.of(1, List.of(new Object())))))
            .isInstanceOf(UnsupportedValueException.class);
    }

    @Test
    @DisplayName("The child's exception reaches the caller unchanged")
    void testSameInstance() {
        List<Expression> trees = List.of(
            FAILING.add(1),
            col("id").add(FAILING),
            FAILING.not(),
            FAILING.isNull(),
            alwaysTrue().and(col("age").greaterThan(FAILING)),
            col("age").greaterThan(1).or(FAILING),
            col("id").in(1, FAILING),
            FAILING.in(1, 2),
            col("age").between(FAILING, 10),
            col("age").notBetween(1, FAILING),
            function("ABS", FAILING),
            caseWhen(col("age").isNull(), FAILING).end(),
            caseWhen(FAILING, 1).end(),
            command(raw("X"), FAILING),
            value(FAILING));

        for (Expression tree : trees) {
            assertThatThrownBy(() -> sql(tree))
                .as("rendering %s", tree)
                .isSameAs(BOOM);
        }
    }

    @Test
    @DisplayName("Failures do not poison the tree or its siblings")
    void testNoPartialState() {
        BooleanExpression good = col("age").greaterThan(1);
        BooleanExpression bad = good.and(col("id").equalTo(new Object()));

        assertThatThrownBy(() -> sql(bad)).isInstanceOf(UnsupportedValueException.class);
        assertThat(sql(good)).isEqualTo("`age` > 1");
        assertThatThrownBy(() -> sql(bad)).isInstanceOf(UnsupportedValueException.class);
    }

    @Test
    @DisplayName("Build-time folding does not render operands")
    void testFoldingSkipsRendering() {
        assertThat(sql(alwaysFalse().and(FAILING))).isEqualTo("0");
        assertThat(sql(alwaysTrue().or(FAILING))).isEqualTo("1");
    }
}
