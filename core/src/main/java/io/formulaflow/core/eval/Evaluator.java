package io.formulaflow.core.eval;

import io.formulaflow.core.error.OperandTypeException;
import io.formulaflow.core.error.UnknownFunctionException;
import io.formulaflow.core.error.UnknownVariableException;
import io.formulaflow.core.function.Arithmetic;
import io.formulaflow.core.function.CallSite;
import io.formulaflow.core.function.FormulaFunction;
import io.formulaflow.core.model.AggregateDependency;
import io.formulaflow.core.model.ComparisonOperator;
import io.formulaflow.core.model.CompiledFormula;
import io.formulaflow.core.model.Expr;
import io.formulaflow.core.model.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates compiled formulas against a row environment.
 *
 * <p>
 * Names resolve against the row first, then against the aggregate context (precomputed
 * {@code FUNC_column} values and scenario results). The evaluator never mutates either map.
 * Calls go through the closed {@link FormulaFunction} library; nothing else is callable.
 *
 * <p>
 * Thread-safe and stateless. One instance may serve any number of concurrent evaluations.
 */
public final class Evaluator {

    /**
     * Evaluates a formula against a single row.
     *
     * @throws io.formulaflow.core.error.FormulaEvalException if evaluation fails
     */
    public Value evaluate(CompiledFormula formula, Map<String, Value> row) {
        return evaluate(formula, row, Map.of(), null);
    }

    /**
     * Evaluates a formula against a row overlaid on an aggregate context. On a name collision the
     * row wins.
     *
     * @throws io.formulaflow.core.error.FormulaEvalException if evaluation fails
     */
    public Value evaluate(CompiledFormula formula, Map<String, Value> row, Map<String, Value> aggregates) {
        return evaluate(formula, row, aggregates, null);
    }

    /**
     * As {@link #evaluate(CompiledFormula, Map, Map)}, attributing any failure to
     * {@code rowIndex}.
     *
     * @param rowIndex index of the row being evaluated, or {@code null} outside a row context
     */
    public Value evaluate(
            CompiledFormula formula, Map<String, Value> row, Map<String, Value> aggregates, Integer rowIndex) {
        Objects.requireNonNull(formula, "formula must not be null");
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(aggregates, "aggregates must not be null");
        return formula.root().accept(new Evaluation(row, aggregates, new CallSite(formula.text(), rowIndex)));
    }

    /** One evaluation pass: the environment plus the call site errors are attributed to. */
    private static final class Evaluation implements Expr.Visitor<Value> {

        private final Map<String, Value> row;
        private final Map<String, Value> aggregates;
        private final CallSite site;

        Evaluation(Map<String, Value> row, Map<String, Value> aggregates, CallSite site) {
            this.row = row;
            this.aggregates = aggregates;
            this.site = site;
        }

        @Override
        public Value visitConstant(Expr.Constant node) {
            return node.value();
        }

        @Override
        public Value visitVariable(Expr.Variable node) {
            Value value = row.get(node.name());
            if (value == null) {
                value = aggregates.get(node.name());
            }
            if (value == null) {
                throw new UnknownVariableException(node.name(), site.formula(), site.rowIndex());
            }
            return value;
        }

        @Override
        public Value visitBinary(Expr.Binary node) {
            Value left = node.left().accept(this);
            Value right = node.right().accept(this);
            return Arithmetic.binary(node.operator(), left, right, site);
        }

        @Override
        public Value visitNegate(Expr.Negate node) {
            return Arithmetic.negate(node.operand().accept(this), site);
        }

        @Override
        public Value visitComparison(Expr.Comparison node) {
            Value left = node.first().accept(this);
            for (int i = 0; i < node.operators().size(); i++) {
                Value right = node.operands().get(i).accept(this);
                if (left.isNull() || right.isNull()) {
                    return Value.NULL;
                }
                if (!holds(node.operators().get(i), left, right)) {
                    return Value.FALSE;
                }
                left = right;
            }
            return Value.TRUE;
        }

        @Override
        public Value visitCall(Expr.Call node) {
            FormulaFunction function = FormulaFunction.lookup(node.function())
                    .orElseThrow(() -> new UnknownFunctionException(node.function(), site.formula(), site.rowIndex()));

            // SUM(col) and friends read a precomputed FUNC_col when the caller supplied one.
            if (function.isColumnAggregate()
                    && node.arguments().size() == 1
                    && node.arguments().get(0) instanceof Expr.Variable column) {
                Value precomputed =
                        aggregates.get(new AggregateDependency(function.functionName(), column.name()).key());
                if (precomputed != null) {
                    return precomputed;
                }
            }

            List<Value> args = new ArrayList<>(node.arguments().size());
            for (Expr argument : node.arguments()) {
                args.add(argument.accept(this));
            }
            return function.invoke(args, site);
        }

        private boolean holds(ComparisonOperator op, Value left, Value right) {
            if (Arithmetic.isNumericScalar(left) && Arithmetic.isNumericScalar(right)) {
                return compareNumbers(op, number(left), number(right));
            }
            if (left instanceof Value.Str l && right instanceof Value.Str r) {
                return op.test(l.value().compareTo(r.value()));
            }
            if (op.isEquality()) {
                boolean equal = left.equals(right);
                return op == ComparisonOperator.EQ ? equal : !equal;
            }
            throw new OperandTypeException(
                    String.format(
                            "'%s' not supported between %s and %s", op.symbol(), describe(left), describe(right)),
                    site.formula(),
                    site.rowIndex());
        }

        // Primitive comparisons so NaN compares unequal and unordered.
        private static boolean compareNumbers(ComparisonOperator op, double a, double b) {
            return switch (op) {
                case EQ -> a == b;
                case NE -> a != b;
                case LT -> a < b;
                case LE -> a <= b;
                case GT -> a > b;
                case GE -> a >= b;
            };
        }

        private static double number(Value value) {
            if (value instanceof Value.Num n) {
                return n.value();
            }
            return ((Value.Bool) value).value() ? 1.0 : 0.0;
        }

        private static String describe(Value value) {
            return value instanceof Value.Vector ? value.shape() : value.kind();
        }
    }
}
