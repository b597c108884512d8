package com.speccontext.model;

import java.lang.reflect.Method;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The classified, ordered methods of one scenario type.
 *
 * Produced once per type by the method classifier and shared by every instance of that
 * type, so it is immutable. Examples in {@link #getExamples()} are already narrowed to the
 * tagged ones when any example carries a tag.
 */
public class ScenarioMethods {

    private final Class<?>                      scenarioType;
    private final Map<MethodRole, List<Method>> buckets;
    private final Set<Method>                   skippedExamples;
    private final List<String>                  tags;
    private final boolean                       typeSkipped;

    private ScenarioMethods(Builder b) {
        this.scenarioType    = b.scenarioType;
        this.buckets         = Collections.unmodifiableMap(new EnumMap<>(b.buckets));
        this.skippedExamples = Collections.unmodifiableSet(new LinkedHashSet<>(b.skippedExamples));
        this.tags            = List.copyOf(b.tags);
        this.typeSkipped     = b.typeSkipped;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Class<?>     getScenarioType()    { return scenarioType; }
    public List<Method> getArrangeMethods()  { return get(MethodRole.ARRANGE); }
    public List<Method> getActMethods()      { return get(MethodRole.ACT); }
    public List<Method> getTeardownMethods() { return get(MethodRole.TEARDOWN); }
    public List<Method> getExamples()        { return get(MethodRole.EXAMPLE); }
    public List<String> getTags()            { return tags; }

    /** The concrete scenario type carries {@code @Skip} (directly or inherited). */
    public boolean isTypeSkipped()           { return typeSkipped; }

    public List<Method> get(MethodRole role) {
        return buckets.getOrDefault(role, List.of());
    }

    /** The example's declaring type carries {@code @Skip}. */
    public boolean isSkipped(Method example) {
        return skippedExamples.contains(example);
    }

    /** {@code true} when at least one selected example will actually run. */
    public boolean hasRunnableExamples() {
        return getExamples().stream().anyMatch(m -> !isSkipped(m));
    }

    /** Normalized simple name of the scenario type, e.g. {@code calculator specs}. */
    public String getScenarioName() {
        return MethodRole.normalize(scenarioType.getSimpleName());
    }

    @Override
    public String toString() {
        return String.format("ScenarioMethods{type=%s, arrange=%d, act=%d, teardown=%d, examples=%d, skipped=%b}",
            scenarioType.getSimpleName(), getArrangeMethods().size(), getActMethods().size(),
            getTeardownMethods().size(), getExamples().size(), typeSkipped);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(Class<?> scenarioType) { return new Builder(scenarioType); }

    public static class Builder {
        private final Class<?>                      scenarioType;
        private final Map<MethodRole, List<Method>> buckets = new EnumMap<>(MethodRole.class);
        private final Set<Method>                   skippedExamples = new LinkedHashSet<>();
        private List<String>                        tags = List.of();
        private boolean                             typeSkipped;

        private Builder(Class<?> scenarioType) { this.scenarioType = scenarioType; }

        public Builder bucket(MethodRole role, List<Method> methods) { buckets.put(role, List.copyOf(methods)); return this; }
        public Builder skippedExample(Method m)                      { skippedExamples.add(m); return this; }
        public Builder tags(List<String> t)                          { this.tags = t; return this; }
        public Builder typeSkipped(boolean s)                        { this.typeSkipped = s; return this; }
        public ScenarioMethods build()                               { return new ScenarioMethods(this); }
    }
}
