package io.formulaflow.core.function;

import io.formulaflow.core.error.ArityException;
import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.error.ShapeException;

/**
 * Identifies the evaluation an operator or function runs in, so the errors it raises name the
 * formula and row they belong to.
 *
 * @param formula  the formula text being evaluated, or {@code null} when evaluating a bare tree
 * @param rowIndex the row being evaluated, or {@code null} for scenario-level evaluation
 */
public record CallSite(String formula, Integer rowIndex) {

    /** A call site with no formula or row attribution. */
    public static final CallSite UNATTRIBUTED = new CallSite(null, null);

    ShapeException shapeError(String message) {
        return new ShapeException(message, formula, rowIndex);
    }

    ArityException arityError(String function, String expected, int actual) {
        return new ArityException(function, expected, actual, formula, rowIndex);
    }

    OperandTypeException operandTypeError(String message) {
        return new OperandTypeException(message, formula, rowIndex);
    }
}
