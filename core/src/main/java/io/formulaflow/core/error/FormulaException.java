package io.formulaflow.core.error;

/**
 * Abstract base for all formula engine exceptions. Never thrown directly; use the concrete
 * subclasses under {@link FormulaCompileException} or {@link FormulaEvalException}.
 */
public abstract class FormulaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        EVALUATION
    }

    private final String formula;
    private final Phase phase;

    protected FormulaException(String message, String formula, Phase phase) {
        super(message);
        this.formula = formula;
        this.phase = phase;
    }

    /** The formula text that triggered the error, or {@code null} if not known at the throw site. */
    public String formula() {
        return formula;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
