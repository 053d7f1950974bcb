package io.formulaflow.core.model;

import java.util.Objects;

/**
 * An immutable, thread-safe compiled formula: the decoded formula text together with the root of
 * its expression tree. Produced by {@code FormulaCompiler.compile(String)}; a single instance is
 * shared by every caller that compiles the same text.
 *
 * @param text the formula text after markup-entity decoding (the cache key)
 * @param root the root node of the expression tree
 */
public record CompiledFormula(String text, Expr root) {

    public CompiledFormula {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }
}
