package io.formulaflow.core.error;

/** Thrown when a variable is found neither in the row nor in the aggregate context. */
public final class UnknownVariableException extends FormulaEvalException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public UnknownVariableException(String name, String formula, Integer rowIndex) {
        super("Unknown variable '" + name + "'", formula, rowIndex);
        this.name = name;
    }

    /** The unresolved variable name. */
    public String name() {
        return name;
    }
}
