package io.formulaflow.core.analysis;

import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.function.CallSite;
import io.formulaflow.core.function.FormulaFunction;
import io.formulaflow.core.model.AggregateDependency;
import io.formulaflow.core.model.Value;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes column aggregates once per batch so row formulas such as {@code price / SUM(price)}
 * do not rebuild the column on every row.
 *
 * <p>
 * The column is assembled from all rows in row order. Missing and {@code NULL} entries become
 * NaN, so {@code SUM}/{@code AVG}/{@code MIN}/{@code MAX} skip them while {@code COUNT} counts
 * every row. Booleans count as 1/0.
 *
 * <p>
 * A dependency whose column no row holds, or whose column is not numeric, is left out of the
 * result. Formulas reading it then evaluate the call themselves and fail per cell.
 */
public final class ColumnAggregates {

    private static final Logger LOG = LoggerFactory.getLogger(ColumnAggregates.class);

    private ColumnAggregates() {
        // utility class
    }

    /**
     * @param dependencies aggregates to compute, typically from
     *                     {@link DependencyAnalyzer#aggregateDependencies(io.formulaflow.core.model.FormulaBatch)}
     * @param rows         the batch rows
     * @return {@code FUNC_column} to value, in dependency order, for every dependency that could
     *         be computed
     * @throws IllegalArgumentException if a dependency names a function that is not a column
     *                                  aggregate
     */
    public static Map<String, Value> precompute(
            Collection<AggregateDependency> dependencies, List<Map<String, Value>> rows) {
        Map<String, Value> aggregates = new LinkedHashMap<>();
        Map<String, Value.Vector> columns = new HashMap<>();
        for (AggregateDependency dep : dependencies) {
            FormulaFunction function = FormulaFunction.lookup(dep.function())
                    .filter(FormulaFunction::isColumnAggregate)
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Not a column aggregate: '" + dep.function() + "'"));
            if (rows.stream().noneMatch(row -> row.containsKey(dep.column()))) {
                LOG.debug("aggregate.skipped key={} reason=unknown_column", dep.key());
                continue;
            }
            Value.Vector column;
            try {
                column = columns.computeIfAbsent(dep.column(), name -> ColumnVectors.assemble(name, rows, null));
            } catch (OperandTypeException e) {
                LOG.debug("aggregate.skipped key={} reason={}", dep.key(), e.getMessage());
                continue;
            }
            aggregates.put(
                    dep.key(),
                    function.invoke(List.of(column), new CallSite(dep.function() + "(" + dep.column() + ")", null)));
        }
        return aggregates;
    }
}
