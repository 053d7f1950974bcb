package io.formulaflow.core.spi;

import io.formulaflow.core.error.FormulaException;
import java.util.List;

/**
 * Observability hooks for batch execution.
 *
 * <p>
 * Implementations bridge to whatever metrics or tracing system the host uses; the engine itself
 * has no telemetry dependency. Every method has a no-op default, so listeners override only what
 * they need.
 *
 * <p>
 * All methods receive immutable event records. {@link #onCellFailed} may be called from several
 * threads at once when rows are processed in parallel, so implementations must be thread-safe.
 * Exceptions thrown by a listener are caught and logged by the engine and never affect execution.
 */
public interface ExecutionListener {

    /** Called before a batch starts. */
    default void onBatchStarted(BatchStartedEvent event) {}

    /** Called after a batch completes, including batches with isolated failures. */
    default void onBatchCompleted(BatchCompletedEvent event) {}

    /**
     * Called for each failed cell. Under the abort policy this is the last event of the batch.
     */
    default void onCellFailed(CellFailedEvent event) {}

    // --- Event records ---

    /** Event emitted when a batch starts. */
    record BatchStartedEvent(List<String> targets, int rowCount) {
        public BatchStartedEvent {
            targets = List.copyOf(targets);
        }
    }

    /** Event emitted when a batch completes. */
    record BatchCompletedEvent(
            int targetCount, int rowCount, int scenarioFormulaCount, int failureCount, long durationMs) {}

    /**
     * Event emitted when a cell fails.
     *
     * @param rowIndex the failing row, or {@code null} for scenario formulas and formulas that
     *                 did not compile
     */
    record CellFailedEvent(String target, Integer rowIndex, FormulaException.Phase phase, String errorDetail) {}
}
