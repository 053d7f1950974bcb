package io.formulaflow.core.model;

import java.util.Objects;

/**
 * Partition of a {@link FormulaBatch} into row-level and scenario-level formulas. Each side keeps
 * the relative order of the original batch.
 *
 * @param rowFormulas      formulas evaluated independently per row
 * @param scenarioFormulas formulas using a whole-column function, evaluated once per batch
 */
public record Classification(FormulaBatch rowFormulas, FormulaBatch scenarioFormulas) {

    public Classification {
        Objects.requireNonNull(rowFormulas, "rowFormulas must not be null");
        Objects.requireNonNull(scenarioFormulas, "scenarioFormulas must not be null");
    }

    /** {@code true} when the batch needs the scenario and back-propagation phases. */
    public boolean hasScenarioFormulas() {
        return !scenarioFormulas.isEmpty();
    }
}
