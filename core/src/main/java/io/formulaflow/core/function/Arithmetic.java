package io.formulaflow.core.function;

import io.formulaflow.core.model.BinaryOperator;
import io.formulaflow.core.model.Value;

/**
 * Operator semantics shared by the evaluator and the function library.
 *
 * <p>
 * Scalars follow IEEE-754 double arithmetic, with booleans coerced to 1/0. A vector combined
 * with a scalar broadcasts the scalar; two vectors combine elementwise and must have the same
 * length. {@link Value#NULL} on either side yields {@link Value#NULL}.
 *
 * <p>
 * Stateless; all methods are static.
 */
public final class Arithmetic {

    private Arithmetic() {}

    /** Applies a binary operator to two values. */
    public static Value binary(BinaryOperator op, Value left, Value right, CallSite site) {
        if (left.isNull() || right.isNull()) {
            return Value.NULL;
        }
        if (left instanceof Value.Str || right instanceof Value.Str) {
            if (op == BinaryOperator.ADD && left instanceof Value.Str l && right instanceof Value.Str r) {
                return Value.str(l.value() + r.value());
            }
            throw site.operandTypeError(String.format(
                    "unsupported operand kinds for '%s': %s and %s", op.symbol(), left.kind(), right.kind()));
        }
        if (left instanceof Value.Vector lv && right instanceof Value.Vector rv) {
            if (lv.length() != rv.length()) {
                throw site.shapeError(String.format(
                        "operands of '%s' have mismatched shapes: %s and %s", op.symbol(), lv.shape(), rv.shape()));
            }
            double[] out = new double[lv.length()];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.apply(lv.get(i), rv.get(i));
            }
            return Value.vector(out);
        }
        if (left instanceof Value.Vector lv) {
            double r = scalar(right);
            double[] out = new double[lv.length()];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.apply(lv.get(i), r);
            }
            return Value.vector(out);
        }
        if (right instanceof Value.Vector rv) {
            double l = scalar(left);
            double[] out = new double[rv.length()];
            for (int i = 0; i < out.length; i++) {
                out[i] = op.apply(l, rv.get(i));
            }
            return Value.vector(out);
        }
        return Value.num(op.apply(scalar(left), scalar(right)));
    }

    /** Unary minus; elementwise on vectors. */
    public static Value negate(Value operand, CallSite site) {
        if (operand.isNull()) {
            return Value.NULL;
        }
        if (operand instanceof Value.Vector v) {
            double[] out = new double[v.length()];
            for (int i = 0; i < out.length; i++) {
                out[i] = -v.get(i);
            }
            return Value.vector(out);
        }
        if (operand instanceof Value.Str) {
            throw site.operandTypeError("bad operand kind for unary '-': string");
        }
        return Value.num(-scalar(operand));
    }

    /** {@code true} for numbers and booleans, the kinds that take part in arithmetic as scalars. */
    public static boolean isNumericScalar(Value value) {
        return value instanceof Value.Num || value instanceof Value.Bool;
    }

    /**
     * Reads a numeric scalar. Callers must have ruled out strings, vectors and {@code NULL}.
     */
    static double scalar(Value value) {
        if (value instanceof Value.Num n) {
            return n.value();
        }
        if (value instanceof Value.Bool b) {
            return b.value() ? 1.0 : 0.0;
        }
        throw new IllegalStateException("not a numeric scalar: " + value);
    }
}
