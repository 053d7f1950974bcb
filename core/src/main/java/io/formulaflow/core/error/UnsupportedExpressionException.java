package io.formulaflow.core.error;

/**
 * Thrown when the formula uses a recognised construct that lies outside the closed formula
 * grammar: modulo, floor division, boolean keywords, list literals, subscripts, attribute
 * access, keyword arguments, conditional expressions and lambdas.
 */
public final class UnsupportedExpressionException extends FormulaCompileException {

    private static final long serialVersionUID = 1L;

    private final String construct;

    public UnsupportedExpressionException(String construct, String formula, int position) {
        super("Unsupported expression: " + construct + " is not allowed in formulas", formula, position);
        this.construct = construct;
    }

    /** Short description of the rejected construct, e.g. {@code "operator '%'"}. */
    public String construct() {
        return construct;
    }
}
