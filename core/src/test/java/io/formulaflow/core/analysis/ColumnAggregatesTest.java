package io.formulaflow.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulaflow.core.model.AggregateDependency;
import io.formulaflow.core.model.Value;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ColumnAggregates} and {@link ColumnVectors}. */
@DisplayName("ColumnAggregates")
class ColumnAggregatesTest {

    private static Map<String, Value> row(Object... keyValues) {
        Map<String, Value> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], Value.of(keyValues[i + 1]));
        }
        return row;
    }

    private final List<Map<String, Value>> rows = List.of(
            row("price", 10, "qty", 2), row("price", 20, "qty", null), row("price", 30));

    @Test
    @DisplayName("computes every dependency under FUNC_column")
    void precompute() {
        Map<String, Value> aggregates = ColumnAggregates.precompute(
                List.of(
                        new AggregateDependency("SUM", "price"),
                        new AggregateDependency("AVG", "price"),
                        new AggregateDependency("MAX", "price"),
                        new AggregateDependency("MIN", "qty"),
                        new AggregateDependency("COUNT", "qty")),
                rows);

        assertThat(aggregates)
                .containsEntry("SUM_price", Value.num(60))
                .containsEntry("AVG_price", Value.num(20))
                .containsEntry("MAX_price", Value.num(30))
                .containsEntry("MIN_qty", Value.num(2))
                .containsEntry("COUNT_qty", Value.num(3));
    }

    @Test
    @DisplayName("missing and NULL entries are NaN in the assembled column")
    void missingEntriesAreNaN() {
        assertThat(ColumnVectors.assemble("qty", rows, null).elements()).containsExactly(2.0, Double.NaN, Double.NaN);
    }

    @Test
    @DisplayName("string columns are left out of the result")
    void stringColumn() {
        List<Map<String, Value>> named = List.of(row("name", "a", "price", 1), row("name", "b", "price", 2));

        Map<String, Value> aggregates = ColumnAggregates.precompute(
                List.of(new AggregateDependency("COUNT", "name"), new AggregateDependency("SUM", "price")), named);

        assertThat(aggregates).containsOnlyKeys("SUM_price").containsEntry("SUM_price", Value.num(3));
    }

    @Test
    @DisplayName("columns no row holds are left out of the result")
    void unknownColumn() {
        Map<String, Value> aggregates = ColumnAggregates.precompute(
                List.of(new AggregateDependency("SUM", "pricee"), new AggregateDependency("COUNT", "pricee")), rows);

        assertThat(aggregates).isEmpty();
    }

    @Test
    @DisplayName("only column aggregates can be precomputed")
    void rejectsOtherFunctions() {
        assertThatThrownBy(() -> ColumnAggregates.precompute(List.of(new AggregateDependency("NORM", "price")), rows))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
