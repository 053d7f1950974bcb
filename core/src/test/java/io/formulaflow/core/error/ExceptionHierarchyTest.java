package io.formulaflow.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Verifies the two-tier exception structure and the fields each concrete type carries. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void formulaExceptionIsAbstractAndRoot() {
        assertThat(FormulaException.class).isAbstract();
        assertThat(FormulaException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void compileAndEvalTiersAreAbstract() {
        assertThat(FormulaCompileException.class).isAbstract();
        assertThat(FormulaCompileException.class.getSuperclass()).isEqualTo(FormulaException.class);
        assertThat(FormulaEvalException.class).isAbstract();
        assertThat(FormulaEvalException.class.getSuperclass()).isEqualTo(FormulaException.class);
    }

    // --- Compile-time exceptions ---

    @Test
    void syntaxExceptionCarriesPositionAndPhase() {
        var ex = new FormulaSyntaxException("bad", "1 +", 3);

        assertThat(ex).isInstanceOf(FormulaCompileException.class);
        assertThat(ex.formula()).isEqualTo("1 +");
        assertThat(ex.position()).isEqualTo(3);
        assertThat(ex.detail()).isEqualTo("bad");
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.COMPILE);
    }

    @Test
    void unsupportedExpressionNamesTheConstruct() {
        var ex = new UnsupportedExpressionException("operator '%'", "a % b", 2);

        assertThat(ex).isInstanceOf(FormulaCompileException.class);
        assertThat(ex.construct()).isEqualTo("operator '%'");
        assertThat(ex.getMessage()).isEqualTo("Unsupported expression: operator '%' is not allowed in formulas");
    }

    @Test
    void invalidCallTargetIsCompilePhase() {
        var ex = new InvalidCallTargetException("Only simple function calls are allowed", "(f)(x)", 3);

        assertThat(ex).isInstanceOf(FormulaCompileException.class);
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.COMPILE);
    }

    // --- Evaluation exceptions ---

    @Test
    void unknownVariableCarriesNameAndRow() {
        var ex = new UnknownVariableException("price", "price * 2", 4);

        assertThat(ex).isInstanceOf(FormulaEvalException.class);
        assertThat(ex.name()).isEqualTo("price");
        assertThat(ex.rowIndex()).isEqualTo(4);
        assertThat(ex.getMessage()).isEqualTo("Unknown variable 'price'");
        assertThat(ex.phase()).isEqualTo(FormulaException.Phase.EVALUATION);
    }

    @Test
    void unknownFunctionCarriesName() {
        var ex = new UnknownFunctionException("exec", "exec(1)", null);

        assertThat(ex.name()).isEqualTo("exec");
        assertThat(ex.rowIndex()).isNull();
        assertThat(ex.getMessage()).isEqualTo("Function 'exec' is not allowed");
    }

    @Test
    void arityExceptionDescribesExpectedAndActual() {
        var ex = new ArityException("pow", "1 or 2", 3, "pow(1, 2, 3)", 0);

        assertThat(ex.function()).isEqualTo("pow");
        assertThat(ex.actual()).isEqualTo(3);
        assertThat(ex.getMessage()).isEqualTo("pow() takes 1 or 2 argument(s), got 3");
    }

    @Test
    void shapeAndOperandTypeAreEvalExceptions() {
        assertThat(new ShapeException("m", "f", 1)).isInstanceOf(FormulaEvalException.class);
        assertThat(new OperandTypeException("m", "f", 1)).isInstanceOf(FormulaEvalException.class);
    }
}
