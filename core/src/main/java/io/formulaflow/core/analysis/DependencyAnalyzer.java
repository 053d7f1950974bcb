package io.formulaflow.core.analysis;

import io.formulaflow.core.compile.FormulaCompiler;
import io.formulaflow.core.function.FormulaFunction;
import io.formulaflow.core.model.AggregateDependency;
import io.formulaflow.core.model.CompiledFormula;
import io.formulaflow.core.model.Expr;
import io.formulaflow.core.model.FormulaBatch;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Static analysis over compiled formulas: which names a formula reads, which column aggregates it
 * needs, and whether it calls a whole-column (scenario) function.
 *
 * <p>
 * All passes are pure; they never evaluate anything. The text overloads compile through the
 * shared cache, so analysing a formula and then evaluating it parses it once.
 *
 * <p>
 * Thread-safe.
 */
public final class DependencyAnalyzer {

    private final FormulaCompiler compiler;

    public DependencyAnalyzer(FormulaCompiler compiler) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    /**
     * Names the formula reads, in order of first appearance. Names that coincide with a library
     * function are not free identifiers.
     */
    public Set<String> freeIdentifiers(CompiledFormula formula) {
        Set<String> names = new LinkedHashSet<>();
        TreeWalker.walk(formula.root(), node -> {
            if (node instanceof Expr.Variable v && !FormulaFunction.isRegistered(v.name())) {
                names.add(v.name());
            }
        });
        return Collections.unmodifiableSet(names);
    }

    /**
     * @throws io.formulaflow.core.error.FormulaCompileException if the text does not compile
     */
    public Set<String> freeIdentifiers(String formula) {
        return freeIdentifiers(compiler.compile(formula));
    }

    /**
     * Column aggregates the formula needs: every {@code SUM}, {@code AVG}, {@code COUNT},
     * {@code MIN} or {@code MAX} call whose single argument is a bare name. Aggregates over
     * computed arguments such as {@code SUM(a * b)} are not reported.
     */
    public Set<AggregateDependency> aggregateDependencies(CompiledFormula formula) {
        Set<AggregateDependency> deps = new LinkedHashSet<>();
        TreeWalker.walk(formula.root(), node -> {
            if (node instanceof Expr.Call call
                    && call.arguments().size() == 1
                    && call.arguments().get(0) instanceof Expr.Variable column) {
                FormulaFunction.lookup(call.function())
                        .filter(FormulaFunction::isColumnAggregate)
                        .ifPresent(f -> deps.add(new AggregateDependency(f.functionName(), column.name())));
            }
        });
        return Collections.unmodifiableSet(deps);
    }

    /**
     * @throws io.formulaflow.core.error.FormulaCompileException if the text does not compile
     */
    public Set<AggregateDependency> aggregateDependencies(String formula) {
        return aggregateDependencies(compiler.compile(formula));
    }

    /**
     * Union of the aggregate dependencies of every formula in the batch, in batch order.
     *
     * @throws io.formulaflow.core.error.FormulaCompileException if a formula does not compile
     */
    public Set<AggregateDependency> aggregateDependencies(FormulaBatch batch) {
        Set<AggregateDependency> deps = new LinkedHashSet<>();
        for (String target : batch.targets()) {
            deps.addAll(aggregateDependencies(batch.formula(target)));
        }
        return Collections.unmodifiableSet(deps);
    }

    /**
     * {@code true} if the formula calls {@code DOT} or {@code NORM} anywhere. The name match is
     * case-insensitive, so {@code dot(a, b)} also marks a formula as scenario-level (and then
     * fails at evaluation as an unknown function).
     */
    public boolean usesScenarioFunction(CompiledFormula formula) {
        boolean[] found = {false};
        TreeWalker.walk(formula.root(), node -> {
            if (node instanceof Expr.Call call && isScenarioFunctionName(call.function())) {
                found[0] = true;
            }
        });
        return found[0];
    }

    /**
     * @throws io.formulaflow.core.error.FormulaCompileException if the text does not compile
     */
    public boolean usesScenarioFunction(String formula) {
        return usesScenarioFunction(compiler.compile(formula));
    }

    private static boolean isScenarioFunctionName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return FormulaFunction.lookup(upper)
                .map(FormulaFunction::isScenarioFunction)
                .orElse(false);
    }
}
