package com.speccontext.model;

/**
 * A deferred, no-argument piece of scenario code: the value type of the
 * {@code establish}, {@code because}, {@code verify} and {@code cleanup} slots and of
 * every named condition.
 *
 * Unlike {@link Runnable} it may throw checked exceptions, so assertion code can call
 * methods that declare them without wrapping.
 */
@FunctionalInterface
public interface SpecAction {

    /**
     * Marker for a condition that is declared but not written yet. Conditions bound to
     * this exact instance are reported as pending and never invoked.
     */
    SpecAction PENDING = () -> { };

    void run() throws Exception;
}
