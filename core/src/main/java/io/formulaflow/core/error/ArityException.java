package io.formulaflow.core.error;

/** Thrown when a library function is called with an unsupported number of arguments. */
public final class ArityException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    private final String function;
    private final int actual;

    public ArityException(String function, String expected, int actual, String formula, Integer rowIndex) {
        super(
                String.format("%s() takes %s argument(s), got %d", function, expected, actual),
                formula,
                rowIndex);
        this.function = function;
        this.actual = actual;
    }

    /** The function that was called. */
    public String function() {
        return function;
    }

    /** The number of arguments actually supplied. */
    public int actual() {
        return actual;
    }
}
