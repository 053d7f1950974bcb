package io.formulaflow.core.error;

/** Thrown when a call names a function that is not part of the function library. */
public final class UnknownFunctionException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public UnknownFunctionException(String name, String formula, Integer rowIndex) {
        super("Function '" + name + "' is not allowed", formula, rowIndex);
        this.name = name;
    }

    /** The unregistered function name, exactly as written in the formula. */
    public String name() {
        return name;
    }
}
