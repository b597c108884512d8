package com.speccontext.model;

/**
 * One named assertion within an example.
 *
 * Created either through {@link #named} (the {@code it(...)} registrations made while an
 * example method runs) or through {@link #verifying} (the single headline condition
 * synthesized from the {@code verify} slot). The action is invocation-guarded, and the
 * first captured failure is kept: a condition is evaluated at most once per cycle.
 */
public class TestCondition {

    private static final String IT_PREFIX = "it";

    private final String          name;
    private final InvokableAction action;
    private final boolean         verifyDerived;

    private Throwable       failure;  // null = no failure captured
    private ConditionStatus status;   // null until evaluated

    private TestCondition(String name, SpecAction action, boolean verifyDerived) {
        this.name          = name;
        this.action        = new InvokableAction(action);
        this.verifyDerived = verifyDerived;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    /** A condition registered by name; {@code null} action means pending. */
    public static TestCondition named(String name, SpecAction action) {
        return new TestCondition(name, action == null ? SpecAction.PENDING : action, false);
    }

    /** The headline condition of an example that assigned {@code verify}. */
    public static TestCondition verifying(String exampleName, SpecAction verify) {
        return new TestCondition(exampleName, verify, true);
    }

    // ── Evaluation ────────────────────────────────────────────────────────────

    /**
     * Runs the action unless it already ran.
     *
     * @throws ActionInvocationException wrapping anything the action threw
     */
    public void invoke() {
        action.invoke();
    }

    /** Captures a failure. Only the first one is kept. */
    public void failed(Throwable error) {
        if (failure == null) {
            failure = error;
        }
        status = ConditionStatus.FAILED;
    }

    public void record(ConditionStatus status) {
        this.status = status;
    }

    public boolean isPending() {
        return action.isDefinedBy(SpecAction.PENDING);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String          getName()        { return name; }
    public Throwable       getFailure()     { return failure; }
    public boolean         hasFailed()      { return failure != null; }
    public ConditionStatus getStatus()      { return status; }
    public boolean         isInvoked()      { return action.isInvoked(); }
    public boolean         isVerifyDerived(){ return verifyDerived; }

    /**
     * The name as rendered in the transcript. Named conditions read as a sentence
     * starting with "it"; the verify headline keeps the example's name.
     */
    public String displayName() {
        if (verifyDerived || name.startsWith(IT_PREFIX)) {
            return name;
        }
        return IT_PREFIX + " " + name;
    }

    @Override
    public String toString() {
        return displayName();
    }
}
