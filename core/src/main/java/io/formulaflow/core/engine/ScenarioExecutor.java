package io.formulaflow.core.engine;

import io.formulaflow.core.analysis.ColumnVectors;
import io.formulaflow.core.analysis.DependencyAnalyzer;
import io.formulaflow.core.analysis.FormulaClassifier;
import io.formulaflow.core.compile.FormulaCompiler;
import io.formulaflow.core.config.EngineConfig;
import io.formulaflow.core.error.FormulaCompileException;
import io.formulaflow.core.error.FormulaEvalException;
import io.formulaflow.core.error.FormulaException;
import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.eval.Evaluator;
import io.formulaflow.core.model.BatchResult;
import io.formulaflow.core.model.CellFailure;
import io.formulaflow.core.model.Classification;
import io.formulaflow.core.model.CompiledFormula;
import io.formulaflow.core.model.FormulaBatch;
import io.formulaflow.core.model.Value;
import io.formulaflow.core.spi.ExecutionListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a formula batch over a set of rows in three phases.
 *
 * <ol>
 * <li><b>Row phase.</b> Each row is copied and the row-level formulas are evaluated against the
 * copy in batch order, each result written back so later formulas can read it.</li>
 * <li><b>Scenario phase.</b> Every name the scenario formulas read that is a column of the first
 * computed row becomes a whole-column vector; other names resolve from the aggregate context.
 * Scenario formulas are then evaluated once each, in batch order, and each result is visible to
 * the ones after it.</li>
 * <li><b>Back-propagation.</b> The scenario results are injected into every row, and the row
 * formulas that read a scenario target are re-evaluated once, in batch order.</li>
 * </ol>
 *
 * <p>
 * Back-propagation is a single pass. A row formula that reads another row formula which was
 * itself re-evaluated sees the new value only if it comes later in the batch; a formula that
 * does not read a scenario target at all keeps its row-phase value even if an input it reads
 * changed. There is no fixed-point iteration.
 *
 * <p>
 * Under {@link FailurePolicy#ISOLATE} a failing cell holds {@code NULL} and is reported in
 * {@link BatchResult#failures()}. A formula that does not compile, and a failing scenario
 * formula, are reported once with no row index. Row-phase failures of formulas that
 * back-propagation re-evaluates are provisional and only the re-evaluation's outcome counts.
 *
 * <p>
 * Thread-safe. Input rows are never mutated.
 */
public final class ScenarioExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ScenarioExecutor.class);

    private final FormulaCompiler compiler;
    private final Evaluator evaluator;
    private final DependencyAnalyzer analyzer;
    private final FormulaClassifier classifier;
    private final FailurePolicy failurePolicy;
    private final boolean parallelRows;
    private final int parallelThreshold;
    private final ExecutionListener listener;

    /**
     * Creates an executor with no listener.
     */
    public ScenarioExecutor(
            FormulaCompiler compiler,
            Evaluator evaluator,
            DependencyAnalyzer analyzer,
            FormulaClassifier classifier,
            EngineConfig config) {
        this(compiler, evaluator, analyzer, classifier, config, null);
    }

    /**
     * @param listener optional listener for batch lifecycle events, may be {@code null}
     */
    public ScenarioExecutor(
            FormulaCompiler compiler,
            Evaluator evaluator,
            DependencyAnalyzer analyzer,
            FormulaClassifier classifier,
            EngineConfig config,
            ExecutionListener listener) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.failurePolicy = config.failurePolicy();
        this.parallelRows = config.parallelRows();
        this.parallelThreshold = config.parallelThreshold();
        this.listener = listener; // nullable
    }

    /** Executes a batch with no precomputed aggregates. */
    public BatchResult execute(FormulaBatch batch, List<Map<String, Value>> rows) {
        return execute(batch, rows, Map.of());
    }

    /**
     * Executes a batch.
     *
     * @param batch      target to formula, in evaluation order
     * @param rows       input rows; never modified
     * @param aggregates precomputed {@code FUNC_column} values (and any other batch-wide names)
     *                   visible to every formula beneath the row
     * @return every target's per-row values, in batch order
     * @throws FormulaException under {@link FailurePolicy#ABORT_BATCH}, the first failure
     */
    public BatchResult execute(
            FormulaBatch batch, List<Map<String, Value>> rows, Map<String, Value> aggregates) {
        Objects.requireNonNull(batch, "batch must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        Objects.requireNonNull(aggregates, "aggregates must not be null");

        long startNanos = System.nanoTime();
        notifyStarted(batch, rows.size());
        Run run = new Run(batch, rows, aggregates);
        BatchResult result = run.execute();
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;

        LOG.info(
                "batch.completed targets={} rows={} scenario_formulas={} failures={} duration_ms={}",
                batch.size(),
                rows.size(),
                run.scenarioFormulaCount(),
                result.failures().size(),
                durationMs);
        notifyCompleted(
                new ExecutionListener.BatchCompletedEvent(
                        batch.size(), rows.size(), run.scenarioFormulaCount(), result.failures().size(), durationMs));
        return result;
    }

    /** State of one batch execution. */
    private final class Run {

        private final FormulaBatch batch;
        private final List<Map<String, Value>> rows;
        private final Map<String, Value> aggregates;
        private final Map<String, CompiledFormula> compiled = new HashMap<>();
        private final Queue<CellFailure> failures = new ConcurrentLinkedQueue<>();
        private Classification classification;

        Run(FormulaBatch batch, List<Map<String, Value>> rows, Map<String, Value> aggregates) {
            this.batch = batch;
            this.rows = rows;
            this.aggregates = aggregates;
        }

        int scenarioFormulaCount() {
            return classification == null ? 0 : classification.scenarioFormulas().size();
        }

        BatchResult execute() {
            classification = classifier.classify(batch);
            if (rows.isEmpty()) {
                Map<String, List<Value>> columns = new LinkedHashMap<>();
                batch.targets().forEach(target -> columns.put(target, List.of()));
                return new BatchResult(columns, List.of(), 0);
            }
            compileAll();

            List<String> rowTargets = classification.rowFormulas().targets();
            List<String> scenarioTargets = classification.scenarioFormulas().targets();
            Set<String> backPropagated = backPropagatedTargets(rowTargets, scenarioTargets);

            LOG.debug("batch.phase phase=row rows={} row_formulas={}", rows.size(), rowTargets.size());
            List<Map<String, Value>> computed = new ArrayList<>(Collections.nCopies(rows.size(), null));
            rowIndexes().forEach(i -> computed.set(i, rowPhase(i, rowTargets, backPropagated)));

            Map<String, Value> scenarioResults = Map.of();
            if (classification.hasScenarioFormulas()) {
                LOG.debug("batch.phase phase=scenario scenario_formulas={}", scenarioTargets);
                scenarioResults = scenarioPhase(scenarioTargets, computed);

                LOG.debug("batch.phase phase=back_propagation row_formulas={}", backPropagated);
                Map<String, Value> injected = scenarioResults;
                rowIndexes().forEach(i -> backPropagate(i, computed.get(i), injected, backPropagated));
            }
            return assemble(computed, scenarioResults, scenarioTargets);
        }

        private void compileAll() {
            for (String target : batch.targets()) {
                try {
                    compiled.put(target, compiler.compile(batch.formula(target)));
                } catch (FormulaCompileException e) {
                    fail(target, null, e);
                }
            }
        }

        /** Row formulas that read at least one scenario target. */
        private Set<String> backPropagatedTargets(List<String> rowTargets, List<String> scenarioTargets) {
            Set<String> result = new LinkedHashSet<>();
            if (scenarioTargets.isEmpty()) {
                return result;
            }
            for (String target : rowTargets) {
                CompiledFormula formula = compiled.get(target);
                if (formula != null
                        && !Collections.disjoint(analyzer.freeIdentifiers(formula), scenarioTargets)) {
                    result.add(target);
                }
            }
            return result;
        }

        private IntStream rowIndexes() {
            IntStream indexes = IntStream.range(0, rows.size());
            return parallelRows && rows.size() >= parallelThreshold ? indexes.parallel() : indexes;
        }

        private Map<String, Value> rowPhase(int rowIndex, List<String> rowTargets, Set<String> backPropagated) {
            Map<String, Value> env = new HashMap<>(rows.get(rowIndex));
            for (String target : rowTargets) {
                CompiledFormula formula = compiled.get(target);
                Value value = Value.NULL;
                if (formula != null) {
                    try {
                        value = evaluator.evaluate(formula, env, aggregates, rowIndex);
                    } catch (FormulaEvalException e) {
                        // Re-evaluated after the scenario phase; that outcome is the one reported.
                        if (!backPropagated.contains(target)) {
                            fail(target, rowIndex, e);
                        }
                    }
                }
                env.put(target, value);
            }
            return env;
        }

        private Map<String, Value> scenarioPhase(List<String> scenarioTargets, List<Map<String, Value>> computed) {
            Map<String, Value> context = new HashMap<>(aggregates);
            Map<String, OperandTypeException> unusableColumns = new HashMap<>();
            // The first computed row holds every key of the first input row, so any name an input
            // row could supply as a scalar is already a column here. Names it lacks come from the
            // aggregate context or stay unresolved, and evaluation reports the unknown variable.
            Map<String, Value> firstComputed = computed.get(0);
            for (String name : scenarioIdentifiers(scenarioTargets)) {
                if (firstComputed.containsKey(name)) {
                    try {
                        context.put(name, ColumnVectors.assemble(name, computed, null));
                    } catch (OperandTypeException e) {
                        unusableColumns.put(name, e);
                    }
                }
            }

            Map<String, Value> results = new LinkedHashMap<>();
            for (String target : scenarioTargets) {
                CompiledFormula formula = compiled.get(target);
                Value value = Value.NULL;
                if (formula != null) {
                    try {
                        requireUsableColumns(formula, unusableColumns, results);
                        value = evaluator.evaluate(formula, Map.of(), context, null);
                    } catch (FormulaEvalException e) {
                        fail(target, null, e);
                    }
                }
                context.put(target, value);
                results.put(target, value);
            }
            return results;
        }

        private Set<String> scenarioIdentifiers(List<String> scenarioTargets) {
            Set<String> names = new LinkedHashSet<>();
            for (String target : scenarioTargets) {
                CompiledFormula formula = compiled.get(target);
                if (formula != null) {
                    names.addAll(analyzer.freeIdentifiers(formula));
                }
            }
            return names;
        }

        private void requireUsableColumns(
                CompiledFormula formula, Map<String, OperandTypeException> unusableColumns, Map<String, Value> results) {
            for (String name : analyzer.freeIdentifiers(formula)) {
                OperandTypeException cause = unusableColumns.get(name);
                if (cause != null && !results.containsKey(name)) {
                    throw new OperandTypeException(cause.getMessage(), formula.text(), null);
                }
            }
        }

        private void backPropagate(
                int rowIndex, Map<String, Value> env, Map<String, Value> scenarioResults, Set<String> backPropagated) {
            env.putAll(scenarioResults);
            for (String target : backPropagated) {
                Value value = Value.NULL;
                try {
                    value = evaluator.evaluate(compiled.get(target), env, aggregates, rowIndex);
                } catch (FormulaEvalException e) {
                    fail(target, rowIndex, e);
                }
                env.put(target, value);
            }
        }

        private BatchResult assemble(
                List<Map<String, Value>> computed, Map<String, Value> scenarioResults, List<String> scenarioTargets) {
            Map<String, List<Value>> columns = new LinkedHashMap<>();
            for (String target : batch.targets()) {
                List<Value> values = new ArrayList<>(rows.size());
                if (scenarioTargets.contains(target)) {
                    values.addAll(Collections.nCopies(rows.size(), scenarioResults.get(target)));
                } else {
                    for (Map<String, Value> env : computed) {
                        values.add(env.get(target));
                    }
                }
                columns.put(target, values);
            }
            List<CellFailure> ordered = new ArrayList<>(failures);
            ordered.sort(failureOrder());
            return new BatchResult(columns, ordered, rows.size());
        }

        /** Batch-wide failures first, then by row, then by batch order within a row. */
        private Comparator<CellFailure> failureOrder() {
            List<String> order = batch.targets();
            return Comparator.comparing(CellFailure::rowIndex, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparingInt(f -> order.indexOf(f.target()));
        }

        private void fail(String target, Integer rowIndex, FormulaException error) {
            notifyCellFailed(new ExecutionListener.CellFailedEvent(target, rowIndex, error.phase(), error.detail()));
            if (failurePolicy == FailurePolicy.ABORT_BATCH) {
                LOG.warn("batch.aborted target={} row={} error={}", target, rowIndex, error.getMessage());
                throw error;
            }
            LOG.warn("cell.failed target={} row={} error={}", target, rowIndex, error.getMessage());
            failures.add(new CellFailure(target, rowIndex, error));
        }
    }

    // --- Listener notification helpers ---

    private void notifyStarted(FormulaBatch batch, int rowCount) {
        if (listener == null) return;
        try {
            listener.onBatchStarted(new ExecutionListener.BatchStartedEvent(batch.targets(), rowCount));
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onBatchStarted failed", e);
        }
    }

    private void notifyCompleted(ExecutionListener.BatchCompletedEvent event) {
        if (listener == null) return;
        try {
            listener.onBatchCompleted(event);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onBatchCompleted failed", e);
        }
    }

    private void notifyCellFailed(ExecutionListener.CellFailedEvent event) {
        if (listener == null) return;
        try {
            listener.onCellFailed(event);
        } catch (Exception e) {
            LOG.warn("ExecutionListener.onCellFailed failed", e);
        }
    }
}
