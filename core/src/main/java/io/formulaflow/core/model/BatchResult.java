package io.formulaflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a batch execution: for every target, one value per input row in row order, plus the
 * failures recorded along the way. Scenario targets repeat their single result once per row.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class BatchResult {

    private final Map<String, List<Value>> columns;
    private final List<CellFailure> failures;
    private final int rowCount;

    /**
     * @param columns  target to per-row values, in batch order
     * @param failures isolated failures, in the order they were recorded
     * @param rowCount number of input rows
     */
    public BatchResult(Map<String, List<Value>> columns, List<CellFailure> failures, int rowCount) {
        Objects.requireNonNull(columns, "columns must not be null");
        LinkedHashMap<String, List<Value>> copy = new LinkedHashMap<>();
        columns.forEach((target, values) -> {
            if (values.size() != rowCount) {
                throw new IllegalArgumentException(
                        "Column '" + target + "' has " + values.size() + " value(s), expected " + rowCount);
            }
            copy.put(target, List.copyOf(values));
        });
        this.columns = Collections.unmodifiableMap(copy);
        this.failures = List.copyOf(failures);
        this.rowCount = rowCount;
    }

    /** Target names in batch order. */
    public List<String> targets() {
        return List.copyOf(columns.keySet());
    }

    /**
     * Per-row values for a target.
     *
     * @throws IllegalArgumentException if the target was not part of the batch
     */
    public List<Value> values(String target) {
        List<Value> values = columns.get(target);
        if (values == null) {
            throw new IllegalArgumentException("No such target in batch result: '" + target + "'");
        }
        return values;
    }

    /** Per-row values for a target converted with {@link Value#toJava()}; nulls mark skipped cells. */
    public List<Object> javaValues(String target) {
        List<Object> out = new ArrayList<>(rowCount);
        for (Value v : values(target)) {
            out.add(v.toJava());
        }
        return out;
    }

    /** Unmodifiable, batch-ordered view of all columns. */
    public Map<String, List<Value>> columns() {
        return columns;
    }

    public List<CellFailure> failures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int rowCount() {
        return rowCount;
    }

    @Override
    public String toString() {
        return "BatchResult{rows=" + rowCount + ", columns=" + columns + ", failures=" + failures.size() + "}";
    }
}
