package com.speccontext.model;

/**
 * A {@link SpecAction} that executes at most once.
 *
 * Used for the establish / because / cleanup slots harvested from an example, and as
 * the guarded body of every {@link TestCondition}. The guard is set before the action
 * runs, so an action that throws is not retried on a second {@link #invoke()}.
 * Success is not recorded here; callers that care catch {@link ActionInvocationException}.
 */
public class InvokableAction {

    private final SpecAction action;
    private boolean invoked;

    public InvokableAction(SpecAction action) {
        this.action = action;
    }

    /**
     * Runs the wrapped action unless it already ran.
     *
     * @throws ActionInvocationException wrapping anything the action threw
     */
    public void invoke() {
        if (invoked) return;
        invoked = true;

        if (action == null) return;
        try {
            action.run();
        } catch (Throwable t) {
            throw ActionInvocationException.of(t);
        }
    }

    public boolean isInvoked()              { return invoked; }
    public boolean isDefined()              { return action != null; }

    /** {@code true} when this wraps exactly {@code comparison} (identity, not equality). */
    public boolean isDefinedBy(SpecAction comparison) {
        return action == comparison;
    }
}
