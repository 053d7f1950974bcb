package io.formulaflow.core.error;

/** Thrown when formula text is not a valid expression in the formula grammar. */
public final class FormulaSyntaxException extends FormulaCompileException {

    private static final long serialVersionUID = 1L;

    public FormulaSyntaxException(String message, String formula, int position) {
        super(message, formula, position);
    }
}
