package io.formulaflow.core.function;

import io.formulaflow.core.model.BinaryOperator;
import io.formulaflow.core.model.Value;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of functions a formula may call. Names are matched exactly (case-sensitive);
 * there is no runtime registration, so an unvetted function cannot be made callable.
 *
 * <p>
 * Every function checks its arity first, then returns {@link Value#NULL} if any argument is
 * {@code NULL}, then applies its own semantics. Whole-column functions skip NaN entries, except
 * {@link #COUNT}, which counts every element.
 *
 * <p>
 * Thread-safe and immutable.
 */
public enum FormulaFunction {

    /** {@code pow(x)} squares; {@code pow(x, y)} raises {@code x} to {@code y}. */
    POW("pow", 1, 2) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value exponent = args.size() == 1 ? Value.num(2) : args.get(1);
            return Arithmetic.binary(BinaryOperator.POWER, args.get(0), exponent, site);
        }
    },

    /** Square root; {@code NULL} (not an error) for negative input. */
    SQRT("sqrt", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            double x = requireScalar(args, 0, site);
            if (x < 0) {
                return Value.NULL;
            }
            return Value.num(Math.sqrt(x));
        }
    },

    /** Absolute value; elementwise on vectors. */
    ABS("abs", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value arg = args.get(0);
            if (arg instanceof Value.Vector v) {
                double[] out = new double[v.length()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = Math.abs(v.get(i));
                }
                return Value.vector(out);
            }
            return Value.num(Math.abs(requireScalar(args, 0, site)));
        }
    },

    /** Smallest element of one vector, or smallest of two or more scalars. */
    MIN_OF("min", 1, Integer.MAX_VALUE) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            return Value.num(extreme(args, site, true));
        }
    },

    /** Largest element of one vector, or largest of two or more scalars. */
    MAX_OF("max", 1, Integer.MAX_VALUE) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            return Value.num(extreme(args, site, false));
        }
    },

    /** Sum of a vector, skipping NaN. */
    SUM("SUM", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value.Vector v = requireVector(args, 0, site);
            double sum = 0.0;
            for (int i = 0; i < v.length(); i++) {
                double x = v.get(i);
                if (!Double.isNaN(x)) {
                    sum += x;
                }
            }
            return Value.num(sum);
        }
    },

    /** Mean of a vector, skipping NaN; 0 for an empty vector. */
    AVG("AVG", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value.Vector v = requireVector(args, 0, site);
            if (v.length() == 0) {
                return Value.num(0);
            }
            double sum = 0.0;
            int n = 0;
            for (int i = 0; i < v.length(); i++) {
                double x = v.get(i);
                if (!Double.isNaN(x)) {
                    sum += x;
                    n++;
                }
            }
            return Value.num(n == 0 ? Double.NaN : sum / n);
        }
    },

    /** Number of elements, NaN included. */
    COUNT("COUNT", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            return Value.num(requireVector(args, 0, site).length());
        }
    },

    /** Smallest non-NaN element of a vector; NaN if there is none. */
    MIN("MIN", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            return Value.num(columnExtreme(requireVector(args, 0, site), true));
        }
    },

    /** Largest non-NaN element of a vector; NaN if there is none. */
    MAX("MAX", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            return Value.num(columnExtreme(requireVector(args, 0, site), false));
        }
    },

    /** Dot product of two equal-length vectors, skipping pairs where either side is NaN. */
    DOT("DOT", 2, 2) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value.Vector a = requireVector(args, 0, site);
            Value.Vector b = requireVector(args, 1, site);
            if (a.length() != b.length()) {
                throw site.shapeError(String.format(
                        "DOT() arguments must have equal length, got %s and %s", a.shape(), b.shape()));
            }
            double sum = 0.0;
            for (int i = 0; i < a.length(); i++) {
                double product = a.get(i) * b.get(i);
                if (!Double.isNaN(product)) {
                    sum += product;
                }
            }
            return Value.num(sum);
        }
    },

    /** Euclidean (L2) norm of a vector, skipping NaN. */
    NORM("NORM", 1, 1) {
        @Override
        Value apply(List<Value> args, CallSite site) {
            Value.Vector v = requireVector(args, 0, site);
            double squares = 0.0;
            for (int i = 0; i < v.length(); i++) {
                double x = v.get(i);
                if (!Double.isNaN(x)) {
                    squares += x * x;
                }
            }
            return Value.num(Math.sqrt(squares));
        }
    };

    private static final Map<String, FormulaFunction> BY_NAME;

    static {
        Map<String, FormulaFunction> map = new HashMap<>();
        for (FormulaFunction f : values()) {
            map.put(f.functionName, f);
        }
        BY_NAME = Collections.unmodifiableMap(map);
    }

    private static final String[] ORDINALS = {"first", "second"};

    /** Upper arity bound of functions taking any number of arguments. */
    private static final int VARIADIC = Integer.MAX_VALUE;

    private final String functionName;
    private final int minArity;
    private final int maxArity;

    FormulaFunction(String functionName, int minArity, int maxArity) {
        this.functionName = functionName;
        this.minArity = minArity;
        this.maxArity = maxArity;
    }

    /**
     * Looks up a function by the exact name used in formulas.
     *
     * @param name the function name, e.g. {@code "pow"} or {@code "DOT"}
     * @return the function, or empty if no function has that name
     */
    public static Optional<FormulaFunction> lookup(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /** Returns {@code true} if {@code name} is exactly the name of a library function. */
    public static boolean isRegistered(String name) {
        return BY_NAME.containsKey(name);
    }

    /** The name used to call this function in formulas. */
    public String functionName() {
        return functionName;
    }

    /**
     * {@code true} for {@link #DOT} and {@link #NORM}: functions that need whole columns and make
     * a formula scenario-level.
     */
    public boolean isScenarioFunction() {
        return this == DOT || this == NORM;
    }

    /**
     * {@code true} for the column aggregates {@link #SUM}, {@link #AVG}, {@link #COUNT},
     * {@link #MIN} and {@link #MAX}, which callers may precompute once per batch.
     */
    public boolean isColumnAggregate() {
        return this == SUM || this == AVG || this == COUNT || this == MIN || this == MAX;
    }

    /**
     * Calls this function.
     *
     * @param args evaluated arguments, in call order
     * @param site the evaluation the call belongs to, for error attribution
     * @return the result, or {@link Value#NULL} if any argument is {@code NULL}
     * @throws io.formulaflow.core.error.ArityException        on a wrong number of arguments
     * @throws io.formulaflow.core.error.ShapeException        on a scalar where a vector is
     *                                                          required or vice versa
     * @throws io.formulaflow.core.error.OperandTypeException  on a string argument
     */
    public Value invoke(List<Value> args, CallSite site) {
        if (args.size() < minArity || args.size() > maxArity) {
            throw site.arityError(functionName, expectedArity(), args.size());
        }
        for (Value arg : args) {
            if (arg.isNull()) {
                return Value.NULL;
            }
        }
        return apply(args, site);
    }

    abstract Value apply(List<Value> args, CallSite site);

    private String expectedArity() {
        if (maxArity == VARIADIC) {
            return "at least " + minArity;
        }
        if (minArity == maxArity) {
            return "exactly " + minArity;
        }
        return minArity + " or " + maxArity;
    }

    private String describeArgument(int index) {
        String position = index < ORDINALS.length ? ORDINALS[index] : "#" + (index + 1);
        return functionName + "() " + position + " argument";
    }

    Value.Vector requireVector(List<Value> args, int index, CallSite site) {
        Value arg = args.get(index);
        if (arg instanceof Value.Vector v) {
            return v;
        }
        throw site.shapeError(String.format(
                "%s must be a one-dimensional vector, got %s %s",
                describeArgument(index), arg.shape(), arg.kind()));
    }

    double requireScalar(List<Value> args, int index, CallSite site) {
        Value arg = args.get(index);
        if (arg instanceof Value.Vector) {
            throw site.shapeError(String.format("%s must be a scalar, got %s", describeArgument(index), arg.shape()));
        }
        if (!Arithmetic.isNumericScalar(arg)) {
            throw site.operandTypeError(
                    String.format("%s must be numeric, got %s", describeArgument(index), arg.kind()));
        }
        return Arithmetic.scalar(arg);
    }

    /** {@code min}/{@code max}: one vector, or two or more scalars. */
    double extreme(List<Value> args, CallSite site, boolean smallest) {
        if (args.size() == 1) {
            Value.Vector v = requireVector(args, 0, site);
            if (v.length() == 0) {
                throw site.shapeError(functionName + "() arg is an empty vector");
            }
            double result = v.get(0);
            for (int i = 1; i < v.length(); i++) {
                result = smallest ? Math.min(result, v.get(i)) : Math.max(result, v.get(i));
            }
            return result;
        }
        double result = requireScalar(args, 0, site);
        for (int i = 1; i < args.size(); i++) {
            double x = requireScalar(args, i, site);
            result = smallest ? Math.min(result, x) : Math.max(result, x);
        }
        return result;
    }

    static double columnExtreme(Value.Vector v, boolean smallest) {
        double result = Double.NaN;
        for (int i = 0; i < v.length(); i++) {
            double x = v.get(i);
            if (Double.isNaN(x)) {
                continue;
            }
            if (Double.isNaN(result) || (smallest ? x < result : x > result)) {
                result = x;
            }
        }
        return result;
    }
}
