package io.formulaflow.core.model;

import java.util.Objects;

/**
 * A column aggregate a formula needs, e.g. {@code SUM(sales)} yields {@code (SUM, sales)}.
 * Callers precompute these once per batch and pass them in the aggregate context under
 * {@link #key()}.
 *
 * @param function the aggregate function name ({@code SUM}, {@code AVG}, {@code COUNT},
 *                 {@code MIN} or {@code MAX})
 * @param column   the column the aggregate runs over
 */
public record AggregateDependency(String function, String column) {

    public AggregateDependency {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(column, "column must not be null");
    }

    /** The aggregate-context key for this dependency: {@code FUNC_column}. */
    public String key() {
        return function + "_" + column;
    }
}
