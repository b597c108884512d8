package com.speccontext.model;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One compiled example method.
 *
 * Holds everything phase 1 harvested from a single invocation of the example method:
 * the ordered pre-actions (establish, then because), the post-action (cleanup), and
 * either the verify-derived headline condition or the named conditions in registration
 * order. Act methods are shared by every example of the scenario.
 *
 * Immutable after compilation except for the failure and status fields of its conditions.
 */
public class TestExample {

    private final String                name;
    private final boolean               skipped;
    private final List<InvokableAction> preActions;
    private final List<InvokableAction> postActions;
    private final TestCondition         verifyCondition;  // null when the example did not assign verify
    private final List<TestCondition>   conditions;
    private final List<Method>          actMethods;

    private TestExample(Builder b) {
        this.name            = b.name;
        this.skipped         = b.skipped;
        this.preActions      = Collections.unmodifiableList(new ArrayList<>(b.preActions));
        this.postActions     = Collections.unmodifiableList(new ArrayList<>(b.postActions));
        this.verifyCondition = b.verifyCondition;
        this.conditions      = Collections.unmodifiableList(new ArrayList<>(b.conditions));
        this.actMethods      = b.actMethods != null ? b.actMethods : List.of();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    /** The raw method name, e.g. {@code when_adding_two_numbers}. */
    public String                getName()            { return name; }
    public boolean               isSkipped()          { return skipped; }
    public List<InvokableAction> getPreActions()      { return preActions; }
    public List<InvokableAction> getPostActions()     { return postActions; }
    public TestCondition         getVerifyCondition() { return verifyCondition; }
    public List<TestCondition>   getConditions()      { return conditions; }
    public List<Method>          getActMethods()      { return actMethods; }

    public boolean hasVerifyCondition() { return verifyCondition != null; }

    /** Both a verify slot and named conditions were declared; this example cannot run. */
    public boolean isAmbiguous() {
        return verifyCondition != null && !conditions.isEmpty();
    }

    /** Every condition of this example in evaluation order, headline first. */
    public List<TestCondition> allConditions() {
        List<TestCondition> all = new ArrayList<>(conditions.size() + 1);
        if (verifyCondition != null) all.add(verifyCondition);
        all.addAll(conditions);
        return all;
    }

    public List<TestCondition> failedConditions() {
        return allConditions().stream()
            .filter(TestCondition::hasFailed)
            .toList();
    }

    @Override
    public String toString() {
        return String.format("TestExample{name=%s, skipped=%b, pre=%d, post=%d, verify=%b, conditions=%d}",
            name, skipped, preActions.size(), postActions.size(), verifyCondition != null, conditions.size());
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(String name) { return new Builder(name); }

    public static class Builder {
        private final String                name;
        private boolean                     skipped;
        private final List<InvokableAction> preActions  = new ArrayList<>();
        private final List<InvokableAction> postActions = new ArrayList<>();
        private TestCondition               verifyCondition;
        private final List<TestCondition>   conditions  = new ArrayList<>();
        private List<Method>                actMethods;

        private Builder(String name) { this.name = name; }

        public Builder skipped(boolean s)                 { this.skipped = s; return this; }
        public Builder preAction(SpecAction a)            { this.preActions.add(new InvokableAction(a)); return this; }
        public Builder postAction(SpecAction a)           { this.postActions.add(new InvokableAction(a)); return this; }
        public Builder verifyCondition(TestCondition c)   { this.verifyCondition = c; return this; }
        public Builder conditions(List<TestCondition> c)  { this.conditions.addAll(c); return this; }
        public Builder actMethods(List<Method> m)         { this.actMethods = m; return this; }
        public TestExample build()                        { return new TestExample(this); }
    }
}
