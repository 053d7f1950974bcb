package io.formulaflow.core.model;

import io.formulaflow.core.error.FormulaException;
import java.util.Objects;

/**
 * A failed evaluation recorded by the batch executor when failures are isolated. The failed cell
 * holds {@link Value#NULL} in the {@link BatchResult}.
 *
 * @param target   the target column whose formula failed
 * @param rowIndex the row index, or {@code null} when the failure is not row-specific (a
 *                 scenario formula, or a formula that did not compile)
 * @param error    the failure
 */
public record CellFailure(String target, Integer rowIndex, FormulaException error) {

    public CellFailure {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }
}
