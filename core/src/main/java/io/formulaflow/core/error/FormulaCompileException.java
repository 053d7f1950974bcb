package io.formulaflow.core.error;

/**
 * Abstract parent for compile-time errors. Thrown by {@code FormulaCompiler.compile()} when the
 * formula text cannot be turned into an expression tree. Carries the character {@code position}
 * in the decoded text where the problem was detected.
 */
public abstract class FormulaCompileException extends FormulaException {

    private static final long serialVersionUID = 1L;

    private final int position;

    protected FormulaCompileException(String message, String formula, int position) {
        super(message, formula, Phase.COMPILE);
        this.position = position;
    }

    /** Zero-based offset into the decoded formula text, or {@code -1} if not applicable. */
    public int position() {
        return position;
    }
}
