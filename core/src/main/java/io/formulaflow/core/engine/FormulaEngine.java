package io.formulaflow.core.engine;

import io.formulaflow.core.analysis.ColumnAggregates;
import io.formulaflow.core.analysis.DependencyAnalyzer;
import io.formulaflow.core.analysis.FormulaClassifier;
import io.formulaflow.core.compile.ExpressionCache;
import io.formulaflow.core.compile.FormulaCompiler;
import io.formulaflow.core.config.EngineConfig;
import io.formulaflow.core.error.FormulaCompileException;
import io.formulaflow.core.eval.Evaluator;
import io.formulaflow.core.model.AggregateDependency;
import io.formulaflow.core.model.BatchResult;
import io.formulaflow.core.model.Classification;
import io.formulaflow.core.model.CompiledFormula;
import io.formulaflow.core.model.FormulaBatch;
import io.formulaflow.core.model.Value;
import io.formulaflow.core.spi.ExecutionListener;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point wiring the compiler, cache, evaluator, analyzer, classifier and batch executor
 * together from one {@link EngineConfig}.
 *
 * <p>
 * Thread-safe. Create one engine per configuration and share it; the expression cache it owns is
 * the only mutable state.
 */
public final class FormulaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(FormulaEngine.class);

    private final EngineConfig config;
    private final ExpressionCache cache;
    private final FormulaCompiler compiler;
    private final Evaluator evaluator;
    private final DependencyAnalyzer analyzer;
    private final FormulaClassifier classifier;
    private final ScenarioExecutor executor;

    /** Creates an engine with {@link EngineConfig#defaults()}. */
    public FormulaEngine() {
        this(EngineConfig.defaults());
    }

    public FormulaEngine(EngineConfig config) {
        this(config, null);
    }

    /**
     * @param config   engine configuration
     * @param listener optional listener for batch lifecycle events, may be {@code null}
     */
    public FormulaEngine(EngineConfig config, ExecutionListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.cache = new ExpressionCache(config.cacheCapacity());
        this.compiler = new FormulaCompiler(cache);
        this.evaluator = new Evaluator();
        this.analyzer = new DependencyAnalyzer(compiler);
        this.classifier = new FormulaClassifier(analyzer);
        this.executor = new ScenarioExecutor(compiler, evaluator, analyzer, classifier, config, listener);
        LOG.info(
                "engine.created cache_capacity={} failure_policy={} parallel_rows={} parallel_threshold={}",
                config.cacheCapacity(),
                config.failurePolicy(),
                config.parallelRows(),
                config.parallelThreshold());
    }

    /**
     * @throws io.formulaflow.core.error.FormulaCompileException if the text does not compile
     */
    public CompiledFormula compile(String formula) {
        return compiler.compile(formula);
    }

    /**
     * Compiles (through the cache) and evaluates a single formula against a row.
     *
     * @throws io.formulaflow.core.error.FormulaException if compilation or evaluation fails
     */
    public Value evaluate(String formula, Map<String, Value> row) {
        return evaluator.evaluate(compiler.compile(formula), row);
    }

    /**
     * As {@link #evaluate(String, Map)}, with precomputed aggregates beneath the row.
     *
     * @throws io.formulaflow.core.error.FormulaException if compilation or evaluation fails
     */
    public Value evaluate(String formula, Map<String, Value> row, Map<String, Value> aggregates) {
        return evaluator.evaluate(compiler.compile(formula), row, aggregates);
    }

    public Classification classify(FormulaBatch batch) {
        return classifier.classify(batch);
    }

    public BatchResult execute(FormulaBatch batch, List<Map<String, Value>> rows) {
        return executor.execute(batch, rows);
    }

    public BatchResult execute(FormulaBatch batch, List<Map<String, Value>> rows, Map<String, Value> aggregates) {
        return executor.execute(batch, rows, aggregates);
    }

    /**
     * Finds the column aggregates the batch reads ({@code SUM(col)} and friends), computes each
     * once over {@code rows}, then executes the batch with them in scope.
     *
     * <p>
     * Only input columns are precomputed. An aggregate over a batch target, over a column no row
     * holds, or over a non-numeric column is evaluated in place instead, so its formula fails per
     * cell under the configured {@link FailurePolicy}. Formulas that do not compile contribute no
     * aggregates; the executor reports them.
     */
    public BatchResult executeWithColumnAggregates(FormulaBatch batch, List<Map<String, Value>> rows) {
        Set<AggregateDependency> dependencies = new LinkedHashSet<>();
        for (String target : batch.targets()) {
            try {
                for (AggregateDependency dep : analyzer.aggregateDependencies(batch.formula(target))) {
                    // Batch targets do not exist until the row phase has run.
                    if (!batch.contains(dep.column())) {
                        dependencies.add(dep);
                    }
                }
            } catch (FormulaCompileException e) {
                LOG.debug("batch.aggregates_uncompiled target={} reason={}", target, e.getMessage());
            }
        }
        Map<String, Value> aggregates = ColumnAggregates.precompute(dependencies, rows);
        LOG.debug("batch.aggregates_precomputed keys={}", aggregates.keySet());
        return executor.execute(batch, rows, aggregates);
    }

    public DependencyAnalyzer analyzer() {
        return analyzer;
    }

    public ExpressionCache cache() {
        return cache;
    }

    public EngineConfig config() {
        return config;
    }
}
