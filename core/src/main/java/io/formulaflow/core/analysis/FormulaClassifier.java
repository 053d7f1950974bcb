package io.formulaflow.core.analysis;

import io.formulaflow.core.error.FormulaCompileException;
import io.formulaflow.core.model.Classification;
import io.formulaflow.core.model.FormulaBatch;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a formula batch into row-level and scenario-level formulas.
 *
 * <p>
 * Only {@code DOT} and {@code NORM} make a formula scenario-level. A formula using {@code SUM}
 * or {@code AVG} stays row-level: those read a precomputed aggregate or a vector-valued row
 * entry. A formula that does not compile is classified as row-level; the executor reports its
 * compile error.
 */
public final class FormulaClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaClassifier.class);

    private final DependencyAnalyzer analyzer;

    public FormulaClassifier(DependencyAnalyzer analyzer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    }

    public Classification classify(FormulaBatch batch) {
        Objects.requireNonNull(batch, "batch must not be null");
        FormulaBatch.Builder rows = FormulaBatch.builder();
        FormulaBatch.Builder scenarios = FormulaBatch.builder();
        for (String target : batch.targets()) {
            String formula = batch.formula(target);
            if (isScenarioLevel(target, formula)) {
                scenarios.add(target, formula);
            } else {
                rows.add(target, formula);
            }
        }
        Classification result = new Classification(rows.build(), scenarios.build());
        LOG.debug(
                "batch.classified row_formulas={} scenario_formulas={}",
                result.rowFormulas().targets(),
                result.scenarioFormulas().targets());
        return result;
    }

    private boolean isScenarioLevel(String target, String formula) {
        try {
            return analyzer.usesScenarioFunction(formula);
        } catch (FormulaCompileException e) {
            LOG.debug("batch.classify_uncompiled target={} reason={}", target, e.getMessage());
            return false;
        }
    }
}
