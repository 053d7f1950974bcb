package io.formulaflow.core.engine;

import java.util.Locale;

/** What the batch executor does when a single cell fails. */
public enum FailurePolicy {

    /**
     * The failing cell holds {@code NULL}, the failure is recorded in the result, and the rest of
     * the batch carries on.
     */
    ISOLATE,

    /** The first failure is rethrown and the batch is abandoned. */
    ABORT_BATCH;

    /**
     * Parses a configuration value such as {@code isolate} or {@code abort-batch}
     * (case-insensitive; {@code -} and {@code _} are interchangeable).
     *
     * @throws IllegalArgumentException on an unknown value
     */
    public static FailurePolicy fromString(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (FailurePolicy policy : values()) {
            if (policy.name().equals(normalized)) {
                return policy;
            }
        }
        throw new IllegalArgumentException(
                "Unknown failure policy '" + value + "' (expected 'isolate' or 'abort-batch')");
    }
}
