package io.formulaflow.core.error;

/**
 * Thrown when a call is applied to anything other than a bare function name, e.g.
 * {@code (f)(x)}, {@code a.b(x)} or {@code f(x)(y)}. Computed call targets are rejected by the
 * grammar itself.
 */
public final class InvalidCallTargetException extends FormulaCompileException {

    private static final long serialVersionUID = 1L;

    public InvalidCallTargetException(String message, String formula, int position) {
        super(message, formula, position);
    }
}
