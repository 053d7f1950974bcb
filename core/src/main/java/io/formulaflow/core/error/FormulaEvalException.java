package io.formulaflow.core.error;

/**
 * Abstract parent for evaluation errors. Terminal for the single formula/row evaluation that
 * raised it; the batch executor decides whether that aborts the batch. Carries an additional
 * {@code rowIndex} field identifying the row being evaluated.
 */
public abstract class FormulaEvalException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final Integer rowIndex;

    protected FormulaEvalException(String message, String formula, Integer rowIndex) {
        super(message, formula, Phase.EVALUATION);
        this.rowIndex = rowIndex;
    }

    /** The row the failing evaluation ran against, or {@code null} for scenario-level evaluations. */
    public Integer rowIndex() {
        return rowIndex;
    }
}
