package io.formulaflow.core.error;

/**
 * Thrown when an operator or function receives an operand of an incompatible kind, e.g.
 * subtracting a string or ordering a vector.
 */
public final class OperandTypeException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    public OperandTypeException(String message, String formula, Integer rowIndex) {
        super(message, formula, rowIndex);
    }
}
