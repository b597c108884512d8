package com.speccontext.executor;

import com.speccontext.model.SpecAction;
import com.speccontext.model.TestCondition;

import java.util.List;

/**
 * The compiler's view of what one example method left behind.
 *
 * Implemented by the scenario over its four slots and its condition registry. The
 * compiler resets it before invoking an example method, reads it afterwards, and resets
 * it again so nothing carries over into the next example.
 */
public interface CompilationContext {

    SpecAction establish();

    SpecAction because();

    SpecAction verify();

    SpecAction cleanup();

    /** Conditions registered through {@code it(...)}, in registration order. */
    List<TestCondition> conditions();

    /** Clears the four slots and the condition registry. */
    void reset();
}
