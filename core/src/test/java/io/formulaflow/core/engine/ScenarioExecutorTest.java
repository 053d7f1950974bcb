package io.formulaflow.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.formulaflow.core.config.EngineConfig;
import io.formulaflow.core.error.FormulaSyntaxException;
import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.error.ShapeException;
import io.formulaflow.core.error.UnknownVariableException;
import io.formulaflow.core.model.BatchResult;
import io.formulaflow.core.model.CellFailure;
import io.formulaflow.core.model.FormulaBatch;
import io.formulaflow.core.model.Value;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the three-phase batch protocol, driven through {@link FormulaEngine}. */
@DisplayName("ScenarioExecutor")
class ScenarioExecutorTest {

    private FormulaEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
    }

    static Map<String, Value> row(Object... keyValues) {
        Map<String, Value> row = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], Value.of(keyValues[i + 1]));
        }
        return row;
    }

    private static List<Map<String, Value>> priceRows() {
        return List.of(row("price", 10, "qty", 2), row("price", 20, "qty", 1));
    }

    private static Value num(double v) {
        return Value.num(v);
    }

    @Nested
    @DisplayName("row phase")
    class RowPhase {

        @Test
        @DisplayName("evaluates row formulas per row")
        void perRow() {
            BatchResult result = engine.execute(FormulaBatch.builder().add("rev", "price*qty").build(), priceRows());

            assertThat(result.values("rev")).containsExactly(num(20), num(20));
            assertThat(result.rowCount()).isEqualTo(2);
            assertThat(result.hasFailures()).isFalse();
        }

        @Test
        @DisplayName("later row formulas see earlier outputs in batch order")
        void chainsWithinRow() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("DISC", "sqrt(pow(B,2) - 4 * A * C)")
                    .add("X1", "(-B - DISC) / (2 * A)")
                    .add("X2", "(-B + DISC) / (2 * A)")
                    .build();
            List<Map<String, Value>> rows = List.of(row("A", 1, "B", -3, "C", 2), row("A", 1, "B", 0, "C", 1));

            BatchResult result = engine.execute(batch, rows);

            assertThat(result.values("DISC")).containsExactly(num(1), Value.NULL);
            assertThat(result.values("X1")).containsExactly(num(1), Value.NULL);
            assertThat(result.values("X2")).containsExactly(num(2), Value.NULL);
            // sqrt of a negative discriminant is NULL, which is not a failure
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("input rows are never modified")
        void inputUntouched() {
            Map<String, Value> input = row("price", 10, "qty", 2);
            engine.execute(
                    FormulaBatch.builder().add("rev", "price*qty").add("total", "DOT(price, qty)").build(),
                    List.of(input));

            assertThat(input).containsOnlyKeys("price", "qty");
        }

        @Test
        @DisplayName("zero rows yields empty columns")
        void zeroRows() {
            BatchResult result = engine.execute(
                    FormulaBatch.builder().add("rev", "price*qty").add("total", "DOT(price, qty)").build(), List.of());

            assertThat(result.targets()).containsExactly("rev", "total");
            assertThat(result.values("rev")).isEmpty();
            assertThat(result.values("total")).isEmpty();
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("without scenario formulas the later phases do not run")
        void noScenarioFormulas() {
            BatchResult result = engine.execute(FormulaBatch.builder().add("d", "price * 2").build(), priceRows());

            assertThat(result.values("d")).containsExactly(num(20), num(40));
        }
    }

    @Nested
    @DisplayName("scenario phase")
    class ScenarioPhase {

        @Test
        @DisplayName("scenario results repeat once per row")
        void endToEnd() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("rev", "price*qty")
                    .add("total", "DOT(price,qty)")
                    .build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("rev")).containsExactly(num(20), num(20));
            assertThat(result.values("total")).containsExactly(num(40), num(40));
        }

        @Test
        @DisplayName("computed row columns become vectors")
        void computedColumnsAreVectors() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("rev", "price*qty")
                    .add("mag", "NORM(rev)")
                    .build();
            List<Map<String, Value>> rows = List.of(row("price", 3, "qty", 1), row("price", 2, "qty", 2));

            assertThat(engine.execute(batch, rows).values("mag")).containsExactly(num(5), num(5));
        }

        @Test
        @DisplayName("later scenario formulas read earlier scenario results")
        void scenarioChain() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("total", "DOT(price, qty)")
                    .add("combined", "DOT(qty, qty) + total")
                    .build();

            assertThat(engine.execute(batch, priceRows()).values("combined")).containsExactly(num(45), num(45));
        }

        @Test
        @DisplayName("an input column read by a scenario formula is a whole column, never a first-row scalar")
        void inputColumnIsVector() {
            FormulaBatch batch = FormulaBatch.builder().add("s", "DOT(price, price) + qty").build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("s")).containsOnly(Value.vector(502, 501));
        }

        @Test
        @DisplayName("names that are not columns resolve from the aggregate context")
        void scalarFromAggregates() {
            FormulaBatch batch = FormulaBatch.builder().add("weighted", "DOT(price, qty) * rate").build();

            BatchResult result = engine.execute(batch, priceRows(), Map.of("rate", num(0.5)));

            assertThat(result.values("weighted")).containsExactly(num(20), num(20));
        }

        @Test
        @DisplayName("entries missing on later rows become NaN and are skipped")
        void missingOnLaterRows() {
            FormulaBatch batch = FormulaBatch.builder().add("mag", "NORM(w)").build();
            List<Map<String, Value>> rows = List.of(row("w", 3), row("x", 1), row("w", 4));

            assertThat(engine.execute(batch, rows).values("mag")).containsExactly(num(5), num(5), num(5));
        }

        @Test
        @DisplayName("a name absent from the first row is not assembled into a vector")
        void absentFromFirstRow() {
            FormulaBatch batch = FormulaBatch.builder().add("mag", "NORM(w)").build();
            List<Map<String, Value>> rows = List.of(row("x", 1), row("w", 3), row("w", 4));

            BatchResult result = engine.execute(batch, rows);

            assertThat(result.values("mag")).containsOnly(Value.NULL);
            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.target()).isEqualTo("mag");
                assertThat(f.rowIndex()).isNull();
                assertThat(f.error()).isInstanceOf(UnknownVariableException.class);
            });
        }

        @Test
        @DisplayName("a failed scenario formula is reported once and is NULL in every row")
        void failedScenarioFormula() {
            FormulaBatch batch = FormulaBatch.builder().add("bad", "DOT(price, 5)").build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("bad")).containsExactly(Value.NULL, Value.NULL);
            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.rowIndex()).isNull();
                assertThat(f.error())
                        .isInstanceOf(ShapeException.class)
                        .hasMessageContaining("DOT() second argument");
            });
        }

        @Test
        @DisplayName("a string column cannot become a vector")
        void stringColumn() {
            FormulaBatch batch = FormulaBatch.builder().add("bad", "NORM(name)").build();
            List<Map<String, Value>> rows = List.of(row("name", "a"), row("name", "b"));

            BatchResult result = engine.execute(batch, rows);

            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.error()).isInstanceOf(OperandTypeException.class);
                assertThat(f.error().formula()).isEqualTo("NORM(name)");
            });
        }
    }

    @Nested
    @DisplayName("back-propagation")
    class BackPropagation {

        @Test
        @DisplayName("row formulas reading a scenario result are re-evaluated")
        void reEvaluates() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("rev", "price*qty")
                    .add("total", "DOT(price,qty)")
                    .add("share", "rev / total")
                    .build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("share")).containsExactly(num(0.5), num(0.5));
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("single pass: a formula reading only a re-evaluated row formula keeps its stale value")
        void onePassLeavesTransitiveDependentsStale() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("rev", "price*qty")
                    .add("total", "DOT(price,qty)")
                    .add("share", "rev / total")
                    .add("pct", "share * 100")
                    .build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("share")).containsExactly(num(0.5), num(0.5));
            // pct read share while share was still NULL and is not re-evaluated afterwards.
            assertThat(result.values("pct")).containsExactly(Value.NULL, Value.NULL);
            assertThat(result.failures()).isEmpty();
        }

        @Test
        @DisplayName("re-evaluated formulas see each other in batch order")
        void batchOrderWithinBackPropagation() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("total", "DOT(price,qty)")
                    .add("share", "price * qty / total")
                    .add("pct", "share * 100 + total * 0")
                    .build();

            BatchResult result = engine.execute(batch, priceRows());

            assertThat(result.values("pct")).containsExactly(num(50), num(50));
        }

        @Test
        @DisplayName("a failure during re-evaluation is reported per row")
        void failureDuringReEvaluation() {
            FormulaBatch batch = FormulaBatch.builder()
                    .add("total", "DOT(price,qty)")
                    .add("ratio", "total / bonus")
                    .build();
            List<Map<String, Value>> rows = List.of(row("price", 10, "qty", 2, "bonus", 4), row("price", 20, "qty", 1));

            BatchResult result = engine.execute(batch, rows);

            assertThat(result.values("ratio")).containsExactly(num(10), Value.NULL);
            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.target()).isEqualTo("ratio");
                assertThat(f.rowIndex()).isEqualTo(1);
            });
        }
    }

    @Nested
    @DisplayName("failure policy")
    class Failures {

        private final FormulaBatch batch = FormulaBatch.builder()
                .add("double_a", "a * 2")
                .add("one", "1")
                .build();

        private final List<Map<String, Value>> rows = List.of(row("a", 1), row("b", 2));

        @Test
        @DisplayName("ISOLATE keeps the batch going and records the failed cell")
        void isolate() {
            BatchResult result = engine.execute(batch, rows);

            assertThat(result.values("double_a")).containsExactly(num(2), Value.NULL);
            assertThat(result.values("one")).containsExactly(num(1), num(1));
            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.target()).isEqualTo("double_a");
                assertThat(f.rowIndex()).isEqualTo(1);
                assertThat(f.error()).isInstanceOf(UnknownVariableException.class).hasMessage("Unknown variable 'a'");
            });
        }

        @Test
        @DisplayName("ABORT_BATCH rethrows the first failure")
        void abort() {
            FormulaEngine aborting = new FormulaEngine(
                    EngineConfig.builder().failurePolicy(FailurePolicy.ABORT_BATCH).build());

            UnknownVariableException e =
                    catchThrowableOfType(() -> aborting.execute(batch, rows), UnknownVariableException.class);

            assertThat(e).hasMessage("Unknown variable 'a'");
            assertThat(e.rowIndex()).isEqualTo(1);
        }

        @Test
        @DisplayName("ABORT_BATCH ignores provisional row-phase failures")
        void abortIgnoresProvisionalFailures() {
            FormulaEngine aborting = new FormulaEngine(
                    EngineConfig.builder().failurePolicy(FailurePolicy.ABORT_BATCH).build());
            FormulaBatch withScenario = FormulaBatch.builder()
                    .add("total", "DOT(price,qty)")
                    .add("share", "price * qty / total")
                    .build();

            assertThat(aborting.execute(withScenario, priceRows()).values("share")).containsExactly(num(0.5), num(0.5));
        }

        @Test
        @DisplayName("a formula that does not compile is reported once and is NULL everywhere")
        void compileFailure() {
            FormulaBatch withBad = FormulaBatch.builder().add("bad", "1 +").add("ok", "a").build();

            BatchResult result = engine.execute(withBad, List.of(row("a", 1), row("a", 2)));

            assertThat(result.values("bad")).containsExactly(Value.NULL, Value.NULL);
            assertThat(result.values("ok")).containsExactly(num(1), num(2));
            assertThat(result.failures()).singleElement().satisfies(f -> {
                assertThat(f.rowIndex()).isNull();
                assertThat(f.error()).isInstanceOf(FormulaSyntaxException.class);
            });
        }

        @Test
        @DisplayName("failures are ordered batch-wide first, then by row and batch order")
        void failureOrder() {
            FormulaBatch many = FormulaBatch.builder()
                    .add("x", "missing1")
                    .add("y", "missing2")
                    .add("bad", "(")
                    .build();

            List<CellFailure> failures = engine.execute(many, List.of(row(), row())).failures();

            assertThat(failures)
                    .extracting(f -> f.target() + "@" + f.rowIndex())
                    .containsExactly("bad@null", "x@0", "y@0", "x@1", "y@1");
        }
    }

    @Test
    @DisplayName("parallel rows produce the same result as sequential rows")
    void parallelMatchesSequential() {
        List<Map<String, Value>> rows = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            rows.add(row("price", i, "qty", i % 7));
        }
        FormulaBatch batch = FormulaBatch.builder()
                .add("rev", "price*qty")
                .add("total", "DOT(price,qty)")
                .add("share", "rev / total")
                .build();
        FormulaEngine parallel = new FormulaEngine(
                EngineConfig.builder().parallelRows(true).parallelThreshold(10).build());

        BatchResult expected = engine.execute(batch, rows);
        BatchResult actual = parallel.execute(batch, rows);

        assertThat(actual.columns()).isEqualTo(expected.columns());
    }
}
