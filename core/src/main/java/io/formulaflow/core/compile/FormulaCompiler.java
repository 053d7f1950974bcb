package io.formulaflow.core.compile;

import io.formulaflow.core.error.FormulaSyntaxException;
import io.formulaflow.core.model.CompiledFormula;
import io.formulaflow.core.model.Expr;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles formula text into an immutable expression tree.
 *
 * <p>
 * Text is entity-decoded first, and the decoded text is what gets cached: {@code a &lt; b} and
 * {@code a < b} share one tree. Compilation rejects everything outside the formula grammar up
 * front, so a tree that compiled can only fail at evaluation time on data (unknown names, shapes,
 * operand kinds), never on its structure.
 *
 * <p>
 * Thread-safe. The cache is the only shared state.
 */
public final class FormulaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaCompiler.class);

    private final ExpressionCache cache;

    public FormulaCompiler(ExpressionCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * Compiles a formula, returning a cached tree when the same (decoded) text was compiled
     * before.
     *
     * @param text formula text, possibly containing markup entities
     * @return the compiled formula; identical text yields the identical instance while cached
     * @throws io.formulaflow.core.error.FormulaCompileException if the text is blank, malformed or
     *                                                           uses an unsupported construct
     */
    public CompiledFormula compile(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaSyntaxException(
                    "Invalid formula syntax at position 0: empty formula in formula '" + (text == null ? "" : text)
                            + "'",
                    text,
                    0);
        }
        return cache.get(MarkupEntities.decode(text), FormulaCompiler::parse);
    }

    public ExpressionCache cache() {
        return cache;
    }

    private static CompiledFormula parse(String decoded) {
        LOG.debug("formula.compile formula={}", decoded);
        Expr root = new Parser(decoded, new Lexer(decoded).tokenize()).parse();
        return new CompiledFormula(decoded, root);
    }
}
