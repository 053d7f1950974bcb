package io.formulaflow.core.error;

/**
 * Thrown when a vector-aware function or operator receives an argument of the wrong shape: a
 * scalar where a one-dimensional vector is required, or vectors of different lengths.
 */
public final class ShapeException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    public ShapeException(String message, String formula, Integer rowIndex) {
        super(message, formula, rowIndex);
    }
}
