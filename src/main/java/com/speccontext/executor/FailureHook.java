package com.speccontext.executor;

/**
 * Tells the host runner that a cycle aggregated at least one failed condition.
 *
 * Invoked at most once per cycle, after the transcript has been emitted. Runner adapters
 * implement it by raising their framework's own failure (e.g. TestNG's {@code Assert.fail}).
 */
@FunctionalInterface
public interface FailureHook {
    void fail();
}
