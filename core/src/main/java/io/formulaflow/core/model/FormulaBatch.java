package io.formulaflow.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An insertion-ordered mapping from target column name to formula text.
 *
 * <p>
 * The insertion order is the authoritative evaluation order: row formulas run in this order
 * within a row, and scenario formulas run in this order so later ones can reference earlier
 * results by name. No topological sort is performed.
 *
 * <p>
 * Thread-safe and immutable.
 */
public final class FormulaBatch {

    private static final FormulaBatch EMPTY = new FormulaBatch(new LinkedHashMap<>());

    private final Map<String, String> formulas;

    private FormulaBatch(LinkedHashMap<String, String> formulas) {
        this.formulas = Collections.unmodifiableMap(formulas);
    }

    /** Returns an empty batch. */
    public static FormulaBatch empty() {
        return EMPTY;
    }

    /**
     * Creates a batch from the given map, preserving its iteration order. Pass a
     * {@link LinkedHashMap} (or {@link Map#of()} for a single entry) when order matters.
     *
     * @throws NullPointerException     if a target or formula is null
     * @throws IllegalArgumentException if a target is blank
     */
    public static FormulaBatch of(Map<String, String> formulas) {
        Objects.requireNonNull(formulas, "formulas must not be null");
        Builder builder = builder();
        formulas.forEach(builder::add);
        return builder.build();
    }

    /** Returns a new {@link Builder}. */
    public static Builder builder() {
        return new Builder();
    }

    /** Target names in evaluation order. */
    public List<String> targets() {
        return List.copyOf(formulas.keySet());
    }

    /** The formula text for a target, or {@code null} if the target is not in this batch. */
    public String formula(String target) {
        return formulas.get(target);
    }

    /** {@code true} if the batch defines the target. */
    public boolean contains(String target) {
        return formulas.containsKey(target);
    }

    /** Unmodifiable, insertion-ordered view of target to formula. */
    public Map<String, String> asMap() {
        return formulas;
    }

    public int size() {
        return formulas.size();
    }

    public boolean isEmpty() {
        return formulas.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        // Order is part of a batch's identity.
        return o instanceof FormulaBatch that
                && new ArrayList<>(formulas.entrySet()).equals(new ArrayList<>(that.formulas.entrySet()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(formulas.entrySet()).hashCode();
    }

    @Override
    public String toString() {
        return "FormulaBatch" + formulas;
    }

    /** Builder preserving the order in which targets are added. */
    public static final class Builder {

        private final LinkedHashMap<String, String> formulas = new LinkedHashMap<>();

        Builder() {}

        /**
         * Appends a target. Adding the same target twice is rejected.
         *
         * @return this builder (fluent)
         */
        public Builder add(String target, String formula) {
            Objects.requireNonNull(target, "target must not be null");
            Objects.requireNonNull(formula, "formula must not be null for target '" + target + "'");
            if (target.isBlank()) {
                throw new IllegalArgumentException("target must not be blank");
            }
            if (formulas.putIfAbsent(target, formula) != null) {
                throw new IllegalArgumentException("Duplicate target '" + target + "' in formula batch");
            }
            return this;
        }

        public FormulaBatch build() {
            return new FormulaBatch(new LinkedHashMap<>(formulas));
        }
    }
}
