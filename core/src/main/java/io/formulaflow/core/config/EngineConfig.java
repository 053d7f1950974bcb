package io.formulaflow.core.config;

import io.formulaflow.core.engine.FailurePolicy;
import java.util.Objects;

/**
 * Tuning for a {@link io.formulaflow.core.engine.FormulaEngine}. Use {@link #builder()} or
 * {@link #defaults()}.
 *
 * @param cacheCapacity     maximum number of compiled formulas kept in the expression cache
 * @param failurePolicy     how the batch executor reacts to a failed cell
 * @param parallelRows      process the row and back-propagation phases with a parallel stream
 * @param parallelThreshold minimum row count before {@code parallelRows} takes effect
 */
public record EngineConfig(int cacheCapacity, FailurePolicy failurePolicy, boolean parallelRows, int parallelThreshold) {

    public static final int DEFAULT_CACHE_CAPACITY = 1024;
    public static final int DEFAULT_PARALLEL_THRESHOLD = 1000;

    public EngineConfig {
        Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
        if (cacheCapacity <= 0) {
            throw new IllegalArgumentException("cacheCapacity must be positive, got " + cacheCapacity);
        }
        if (parallelThreshold <= 0) {
            throw new IllegalArgumentException("parallelThreshold must be positive, got " + parallelThreshold);
        }
    }

    /** The default configuration: 1024 cached formulas, isolated failures, sequential rows. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EngineConfig}; every field has a default. */
    public static final class Builder {
        private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
        private FailurePolicy failurePolicy = FailurePolicy.ISOLATE;
        private boolean parallelRows = false;
        private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;

        Builder() {}

        public Builder cacheCapacity(int cacheCapacity) {
            this.cacheCapacity = cacheCapacity;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder parallelRows(boolean parallelRows) {
            this.parallelRows = parallelRows;
            return this;
        }

        public Builder parallelThreshold(int parallelThreshold) {
            this.parallelThreshold = parallelThreshold;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a value is out of range
         */
        public EngineConfig build() {
            return new EngineConfig(cacheCapacity, failurePolicy, parallelRows, parallelThreshold);
        }
    }
}
