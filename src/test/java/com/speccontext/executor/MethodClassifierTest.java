package com.speccontext.executor;

import com.speccontext.core.Order;
import com.speccontext.core.Skip;
import com.speccontext.core.Tag;
import com.speccontext.model.MethodRole;
import com.speccontext.model.ScenarioMethods;
import org.testng.annotations.Test;

import java.lang.reflect.Method;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for role partitioning, ordering, tag selection and skip flags.
 *
 * Fixtures are plain classes classified against {@code Object} as their root type, so no
 * scenario base class is involved.
 */
public class MethodClassifierTest {

    // ── Fixtures ──────────────────────────────────────────────────────────────

    public static class mixed_roles {
        public void given_a_subject() { }
        public void before_anything() { }
        public void do_the_action() { }
        public void finally_close() { }
        public void when_something_happens() { }
        public void should_behave() { }

        public void helper_method() { }                 // no role prefix
        public void whenever() { }                      // no separator
        public void when_given_an_argument(int x) { }   // has a parameter
        public int when_returning_a_value() { return 1; }
        public static void when_static() { }
        void when_package_private() { }
    }

    public static class ordered_methods {
        public void when_b() { }
        public void when_a() { }
        @Order(1) public void when_z_first() { }
    }

    public static class level_one {
        public void before_one() { }
        public void after_one() { }
        public void when_overridden() { }
    }

    public static class level_two extends level_one {
        public void before_two_a() { }
        public void before_two_b() { }
        public void after_two() { }
        @Override public void when_overridden() { }
    }

    public static class tagged_examples {
        @Tag("focus") public void when_focused() { }
        @Tag public void when_unnamed_focus() { }
        public void when_ignored() { }
    }

    public static class runnable_parent {
        public void act_in_parent() { }
        public void when_in_parent() { }
    }

    @Skip
    public static class skipped_child extends runnable_parent {
        public void act_in_child() { }
        public void when_in_child() { }
    }

    public static class grandchild_of_skipped extends skipped_child {
    }

    // ════════════════════════════════════════════════════════════════════════
    // Role partitioning
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void classify_partitionsMethodsByPrefix() {
        ScenarioMethods methods = MethodClassifier.classify(mixed_roles.class, Object.class, false);

        assertThat(names(methods.getArrangeMethods())).containsExactly("before_anything", "given_a_subject");
        assertThat(names(methods.getActMethods())).containsExactly("do_the_action");
        assertThat(names(methods.getTeardownMethods())).containsExactly("finally_close");
        assertThat(names(methods.getExamples())).containsExactly("should_behave", "when_something_happens");
    }

    @Test
    public void classify_ignoresMethodsOfTheWrongShape() {
        ScenarioMethods methods = MethodClassifier.classify(mixed_roles.class, Object.class, false);

        List<String> all = names(methods.getExamples());
        all.addAll(names(methods.getArrangeMethods()));
        all.addAll(names(methods.getActMethods()));
        all.addAll(names(methods.getTeardownMethods()));

        assertThat(all).doesNotContain(
            "helper_method", "whenever", "when_given_an_argument",
            "when_returning_a_value", "when_static", "when_package_private");
    }

    @Test
    public void classify_cachesPerType() {
        ScenarioMethods first  = MethodClassifier.classify(mixed_roles.class, Object.class, false);
        ScenarioMethods second = MethodClassifier.classify(mixed_roles.class, Object.class, false);

        assertThat(second).isSameAs(first);
    }

    @Test
    public void classify_rejectsTypesOutsideTheRoot() {
        assertThatThrownBy(() -> MethodClassifier.classify(mixed_roles.class, level_one.class, false))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("mixed_roles");
    }

    @Test
    public void scenarioName_isTheNormalizedSimpleName() {
        ScenarioMethods methods = MethodClassifier.classify(mixed_roles.class, Object.class, false);

        assertThat(methods.getScenarioName()).isEqualTo("mixed roles");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Ordering
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void classify_ordersWithinAClassByOrderThenName() {
        ScenarioMethods methods = MethodClassifier.classify(ordered_methods.class, Object.class, false);

        assertThat(names(methods.getExamples())).containsExactly("when_z_first", "when_a", "when_b");
    }

    @Test
    public void classify_putsAncestorsFirst() {
        ScenarioMethods methods = MethodClassifier.classify(level_two.class, Object.class, false);

        assertThat(names(methods.getArrangeMethods()))
            .containsExactly("before_one", "before_two_a", "before_two_b");
        assertThat(names(methods.getTeardownMethods()))
            .containsExactly("after_one", "after_two");
    }

    @Test
    public void classify_legacyOrderReversesDeepScenarios() {
        ScenarioMethods methods = MethodClassifier.classify(level_two.class, Object.class, true);

        // bottom-up [two_a, two_b, one] reversed
        assertThat(names(methods.getArrangeMethods()))
            .containsExactly("before_one", "before_two_b", "before_two_a");
        assertThat(names(methods.getTeardownMethods()))
            .containsExactly("after_one", "after_two");
    }

    @Test
    public void classify_legacyOrderLeavesSingleLevelScenariosAlone() {
        ScenarioMethods methods = MethodClassifier.classify(level_one.class, Object.class, true);

        assertThat(names(methods.getExamples())).containsExactly("when_overridden");
        assertThat(names(methods.getArrangeMethods())).containsExactly("before_one");
    }

    @Test
    public void classify_listsOverriddenMethodsOnce() {
        ScenarioMethods methods = MethodClassifier.classify(level_two.class, Object.class, false);

        assertThat(methods.getExamples()).hasSize(1);
        assertThat(methods.getExamples().get(0).getDeclaringClass()).isEqualTo(level_two.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Tags
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void classify_keepsOnlyTaggedExamplesWhenAnyAreTagged() {
        ScenarioMethods methods = MethodClassifier.classify(tagged_examples.class, Object.class, false);

        assertThat(names(methods.getExamples())).containsExactly("when_focused", "when_unnamed_focus");
        assertThat(methods.getTags()).containsExactly("focus");
    }

    @Test
    public void classify_keepsEveryExampleWhenNoneAreTagged() {
        ScenarioMethods methods = MethodClassifier.classify(ordered_methods.class, Object.class, false);

        assertThat(methods.getExamples()).hasSize(3);
        assertThat(methods.getTags()).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Skip
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void classify_flagsExamplesDeclaredOnSkippedTypes() {
        ScenarioMethods methods = MethodClassifier.classify(skipped_child.class, Object.class, false);

        assertThat(methods.isTypeSkipped()).isTrue();
        assertThat(names(methods.getExamples())).containsExactly("when_in_parent", "when_in_child");
        assertThat(methods.isSkipped(example(methods, "when_in_parent"))).isFalse();
        assertThat(methods.isSkipped(example(methods, "when_in_child"))).isTrue();
        assertThat(methods.hasRunnableExamples()).isTrue();
    }

    @Test
    public void classify_dropsActMethodsOfSkippedTypes() {
        ScenarioMethods methods = MethodClassifier.classify(skipped_child.class, Object.class, false);

        assertThat(names(methods.getActMethods())).containsExactly("act_in_parent");
    }

    @Test
    public void classify_inheritsSkipFromSuperclasses() {
        ScenarioMethods methods = MethodClassifier.classify(grandchild_of_skipped.class, Object.class, false);

        assertThat(methods.isTypeSkipped()).isTrue();
        assertThat(MethodClassifier.isSkipped(grandchild_of_skipped.class)).isTrue();
        assertThat(MethodClassifier.isSkipped(runnable_parent.class)).isFalse();
    }

    @Test
    public void roles_areDisjoint() {
        ScenarioMethods methods = MethodClassifier.classify(mixed_roles.class, Object.class, false);

        for (MethodRole role : MethodRole.values()) {
            for (MethodRole other : MethodRole.values()) {
                if (role == other) continue;
                assertThat(methods.get(role)).doesNotContainAnyElementsOf(methods.get(other));
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static List<String> names(List<Method> methods) {
        return new java.util.ArrayList<>(methods.stream().map(Method::getName).toList());
    }

    private static Method example(ScenarioMethods methods, String name) {
        return methods.getExamples().stream()
            .filter(m -> m.getName().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
