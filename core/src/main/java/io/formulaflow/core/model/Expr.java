package io.formulaflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Node of a compiled formula's expression tree.
 *
 * <p>
 * The node kinds form a closed, sealed hierarchy. Consumers implement {@link Visitor}.
 *
 * <p>
 * Thread-safe and immutable. Trees are shared across all evaluations of the same formula text.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    /** One method per node kind. */
    interface Visitor<R> {
        R visitConstant(Constant node);

        R visitVariable(Variable node);

        R visitBinary(Binary node);

        R visitNegate(Negate node);

        R visitComparison(Comparison node);

        R visitCall(Call node);
    }

    // ── Node kinds ──

    /** A numeric, string, boolean or {@code None} literal. */
    record Constant(Value value) implements Expr {
        public Constant {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /** A bare identifier resolved against the row, then the aggregate context. */
    record Variable(String name) implements Expr {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /** {@code left op right} for one of {@code + - * / **}. */
    record Binary(BinaryOperator operator, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /** Unary minus. */
    record Negate(Expr operand) implements Expr {
        public Negate {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNegate(this);
        }
    }

    /**
     * A comparison chain {@code first op[0] operands[0] op[1] operands[1] ...}. Holds iff every
     * adjacent pair holds: {@code a < b < c} means {@code (a < b) and (b < c)}.
     */
    record Comparison(Expr first, List<ComparisonOperator> operators, List<Expr> operands) implements Expr {
        public Comparison {
            Objects.requireNonNull(first, "first must not be null");
            operators = List.copyOf(operators);
            operands = List.copyOf(operands);
            if (operators.isEmpty() || operators.size() != operands.size()) {
                throw new IllegalArgumentException(
                        "Comparison needs one operand per operator, got " + operators.size() + " operator(s) and "
                                + operands.size() + " operand(s)");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    /** {@code NAME(arg, ...)}; the name is resolved through the function library at evaluation time. */
    record Call(String function, List<Expr> arguments) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
