package com.speccontext.model;

import java.util.Locale;

/**
 * The recorded outcome of evaluating one {@link TestCondition}.
 *
 *   PASSED   — the action ran and returned normally
 *   FAILED   — the action threw; the throwable is captured on the condition
 *   PENDING  — the action is {@link SpecAction#PENDING}; never invoked
 *   SKIPPED  — the owning example belongs to a {@code @Skip} type; never invoked
 */
public enum ConditionStatus {
    PASSED,
    FAILED,
    PENDING,
    SKIPPED;

    /** The lower-case word used in transcript lines, e.g. {@code "passed"}. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
