package io.formulaflow.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * A runtime value seen by formulas: a scalar (number, boolean, string), a one-dimensional
 * numeric vector, or the {@link Null} sentinel meaning "not applicable here".
 *
 * <p>
 * Implementations form a sealed hierarchy, so all variants are known at compile time. Values are
 * immutable; {@link Vector} defensively copies its elements on the way in and out.
 */
public sealed interface Value {

    /** The shared "not applicable" sentinel. */
    Null NULL = new Null();

    /** Boolean constants. */
    Bool TRUE = new Bool(true);

    Bool FALSE = new Bool(false);

    /** Short name of the value kind, used in error messages. */
    String kind();

    /** Shape description used in error messages: {@code scalar} or {@code vector[n]}. */
    default String shape() {
        return "scalar";
    }

    /** Returns {@code true} for the {@link Null} sentinel. */
    default boolean isNull() {
        return false;
    }

    /** Converts this value back to a plain Java object ({@code Double}, {@code double[]}, ...). */
    Object toJava();

    static Num num(double value) {
        return new Num(value);
    }

    static Bool bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Str str(String value) {
        return new Str(value);
    }

    static Vector vector(double... elements) {
        return new Vector(elements);
    }

    /**
     * Adapts a plain Java object into a value. Accepts {@code null}, numbers, booleans, character
     * sequences, {@code double[]}/{@code int[]}/{@code long[]} and collections of numbers (null
     * entries become NaN).
     *
     * @throws IllegalArgumentException if the object cannot be represented
     */
    static Value of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof Value v) {
            return v;
        }
        if (raw instanceof Boolean b) {
            return bool(b);
        }
        if (raw instanceof Number n) {
            return num(n.doubleValue());
        }
        if (raw instanceof CharSequence cs) {
            return str(cs.toString());
        }
        if (raw instanceof double[] d) {
            return vector(d);
        }
        if (raw instanceof int[] ints) {
            return vector(Arrays.stream(ints).asDoubleStream().toArray());
        }
        if (raw instanceof long[] longs) {
            return vector(Arrays.stream(longs).asDoubleStream().toArray());
        }
        if (raw instanceof Collection<?> items) {
            double[] out = new double[items.size()];
            int i = 0;
            for (Object item : items) {
                if (item == null) {
                    out[i++] = Double.NaN;
                } else if (item instanceof Number n) {
                    out[i++] = n.doubleValue();
                } else if (item instanceof Boolean b) {
                    out[i++] = b ? 1.0 : 0.0;
                } else {
                    throw new IllegalArgumentException(
                            "Vector elements must be numeric, got: " + item.getClass().getSimpleName());
                }
            }
            return vector(out);
        }
        throw new IllegalArgumentException(
                "Unsupported value type: " + raw.getClass().getName());
    }

    // ── Implementations ──

    /** A double-precision number. */
    record Num(double value) implements Value {
        @Override
        public String kind() {
            return "number";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    /** A boolean; coerces to 1/0 in arithmetic. */
    record Bool(boolean value) implements Value {
        @Override
        public String kind() {
            return "boolean";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    /** A string literal or string column value. */
    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String kind() {
            return "string";
        }

        @Override
        public Object toJava() {
            return value;
        }
    }

    /** A one-dimensional numeric vector, typically a whole column in row order. */
    record Vector(double[] elements) implements Value {
        public Vector {
            Objects.requireNonNull(elements, "elements must not be null");
            elements = elements.clone();
        }

        @Override
        public double[] elements() {
            return elements.clone();
        }

        public int length() {
            return elements.length;
        }

        public double get(int index) {
            return elements[index];
        }

        @Override
        public String kind() {
            return "vector";
        }

        @Override
        public String shape() {
            return "vector[" + elements.length + "]";
        }

        @Override
        public Object toJava() {
            return elements.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vector that && Arrays.equals(elements, that.elements);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(elements);
        }

        @Override
        public String toString() {
            return "Vector" + Arrays.toString(elements);
        }
    }

    /**
     * The "not applicable" sentinel produced by e.g. {@code sqrt} of a negative number. Propagates
     * through arithmetic so downstream formulas are skipped rather than failed.
     */
    record Null() implements Value {
        @Override
        public String kind() {
            return "null";
        }

        @Override
        public boolean isNull() {
            return true;
        }

        @Override
        public Object toJava() {
            return null;
        }
    }
}
