package io.formulaflow.core.function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.error.ShapeException;
import io.formulaflow.core.model.BinaryOperator;
import io.formulaflow.core.model.Value;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link Arithmetic}. */
@DisplayName("Arithmetic")
class ArithmeticTest {

    private static final CallSite SITE = new CallSite("f", null);

    @Test
    @DisplayName("division by zero follows IEEE-754")
    void divisionByZero() {
        assertThat(Arithmetic.binary(BinaryOperator.DIVIDE, Value.num(1), Value.num(0), SITE))
                .isEqualTo(Value.num(Double.POSITIVE_INFINITY));
        assertThat(Arithmetic.binary(BinaryOperator.DIVIDE, Value.num(-1), Value.num(0), SITE))
                .isEqualTo(Value.num(Double.NEGATIVE_INFINITY));
        Value nan = Arithmetic.binary(BinaryOperator.DIVIDE, Value.num(0), Value.num(0), SITE);
        assertThat(((Value.Num) nan).value()).isNaN();
    }

    @Test
    @DisplayName("booleans coerce to 1 and 0")
    void booleansCoerce() {
        assertThat(Arithmetic.binary(BinaryOperator.ADD, Value.TRUE, Value.TRUE, SITE)).isEqualTo(Value.num(2));
        assertThat(Arithmetic.binary(BinaryOperator.MULTIPLY, Value.FALSE, Value.num(5), SITE))
                .isEqualTo(Value.num(0));
    }

    @Test
    @DisplayName("strings concatenate with + and nothing else")
    void strings() {
        assertThat(Arithmetic.binary(BinaryOperator.ADD, Value.str("ab"), Value.str("c"), SITE))
                .isEqualTo(Value.str("abc"));
        assertThatThrownBy(() -> Arithmetic.binary(BinaryOperator.SUBTRACT, Value.str("a"), Value.str("b"), SITE))
                .isInstanceOf(OperandTypeException.class)
                .hasMessage("unsupported operand kinds for '-': string and string");
        assertThatThrownBy(() -> Arithmetic.binary(BinaryOperator.ADD, Value.str("a"), Value.num(1), SITE))
                .isInstanceOf(OperandTypeException.class);
    }

    @Test
    @DisplayName("scalars broadcast over vectors on either side")
    void broadcasting() {
        assertThat(Arithmetic.binary(BinaryOperator.MULTIPLY, Value.vector(1, 2), Value.num(10), SITE))
                .isEqualTo(Value.vector(10, 20));
        assertThat(Arithmetic.binary(BinaryOperator.SUBTRACT, Value.num(10), Value.vector(1, 2), SITE))
                .isEqualTo(Value.vector(9, 8));
    }

    @Test
    @DisplayName("vectors combine elementwise and must match in length")
    void elementwise() {
        assertThat(Arithmetic.binary(BinaryOperator.ADD, Value.vector(1, 2), Value.vector(3, 4), SITE))
                .isEqualTo(Value.vector(4, 6));
        assertThatThrownBy(() -> Arithmetic.binary(BinaryOperator.ADD, Value.vector(1), Value.vector(1, 2), SITE))
                .isInstanceOf(ShapeException.class)
                .hasMessage("operands of '+' have mismatched shapes: vector[1] and vector[2]");
    }

    @Test
    @DisplayName("NULL on either side yields NULL")
    void nullPropagates() {
        assertThat(Arithmetic.binary(BinaryOperator.ADD, Value.NULL, Value.num(1), SITE)).isSameAs(Value.NULL);
        assertThat(Arithmetic.binary(BinaryOperator.ADD, Value.str("a"), Value.NULL, SITE)).isSameAs(Value.NULL);
        assertThat(Arithmetic.negate(Value.NULL, SITE)).isSameAs(Value.NULL);
    }

    @Test
    @DisplayName("negation")
    void negation() {
        assertThat(Arithmetic.negate(Value.num(2), SITE)).isEqualTo(Value.num(-2));
        assertThat(Arithmetic.negate(Value.vector(1, -2), SITE)).isEqualTo(Value.vector(-1, 2));
        assertThat(Arithmetic.negate(Value.TRUE, SITE)).isEqualTo(Value.num(-1));
        assertThatThrownBy(() -> Arithmetic.negate(Value.str("a"), SITE)).isInstanceOf(OperandTypeException.class);
    }
}
