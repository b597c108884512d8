package com.speccontext.executor;

import com.speccontext.model.ActionInvocationException;
import com.speccontext.model.ConditionStatus;
import com.speccontext.model.InvokableAction;
import com.speccontext.model.ScenarioMethods;
import com.speccontext.model.TestCondition;
import com.speccontext.model.TestExample;
import com.speccontext.report.CycleReport;
import com.speccontext.report.Verbalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one execution cycle of a scenario.
 *
 * ## Execution model
 *
 *   1. Tag banner and scenario line are rendered.
 *   2. Arrange methods run once, in classified order.
 *   3. Each selected example is compiled (phase 1) and then executed (phase 2):
 *        pre-actions → act methods → conditions → post-actions
 *      Examples of a skipped type are compiled for their names only; their conditions are
 *      rendered as skipped and nothing else of theirs runs. A skipped body that throws
 *      while compiling is not a structural error.
 *   4. Teardown methods run once.
 *   5. The transcript is emitted, and the failure hook is called once if any condition failed.
 *
 *   Arrange and teardown are left out when every selected example is skipped.
 *
 * ## Failure isolation
 *
 *   A condition that throws is marked failed and the cycle carries on with its siblings and
 *   the remaining examples. Structural errors and exceptions from arrange / act / teardown
 *   methods or pre/post actions abort the cycle.
 *
 * One executor serves one cycle; the owning scenario holds its lock for the duration.
 */
public class ScenarioExecutor {

    private static final Logger log = LoggerFactory.getLogger(ScenarioExecutor.class);

    /** Cycle phases, in order. */
    public enum State { IDLE, ARRANGING, RUNNING_EXAMPLES, TEARING_DOWN, REPORTED }

    private final Object           scenario;
    private final ScenarioMethods  methods;
    private final ScenarioCompiler compiler;
    private final Verbalizer       verbalizer;
    private final FailureHook      failureHook;

    private final List<TestExample> examples = new ArrayList<>();
    private State       state = State.IDLE;
    private CycleReport report;

    public ScenarioExecutor(Object scenario,
                            ScenarioMethods methods,
                            ScenarioCompiler compiler,
                            Verbalizer verbalizer,
                            FailureHook failureHook) {
        this.scenario    = scenario;
        this.methods     = methods;
        this.compiler    = compiler;
        this.verbalizer  = verbalizer;
        this.failureHook = failureHook;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Runs the full cycle.
     *
     * @return the cycle report; also available from {@link #getReport()} when the failure
     *         hook throws
     * @throws SpecificationStructureException  an example is malformed
     * @throws SpecificationExecutionException  an arrange / act / teardown step threw
     */
    public CycleReport run() {
        Instant startedAt = Instant.now();
        log.info("ScenarioExecutor: Executing '{}' ({} example(s), skipped={})",
            methods.getScenarioName(), methods.getExamples().size(), methods.isTypeSkipped());

        try {
            verbalizer.tagBanner(methods.getTags());
            verbalizer.scenarioLine(methods.getScenarioName(), methods.isTypeSkipped());

            boolean runnable = methods.hasRunnableExamples();

            transition(State.ARRANGING);
            if (runnable) {
                invokeAll(methods.getArrangeMethods(), "Arrange method");
            }

            transition(State.RUNNING_EXAMPLES);
            for (Method exampleMethod : methods.getExamples()) {
                TestExample example = compiler.compile(
                    exampleMethod, methods.isSkipped(exampleMethod), methods.getActMethods());
                if (example.isSkipped()) {
                    evaluateConditions(example);
                    verbalizer.endExample();
                } else {
                    execute(example);
                }
                examples.add(example);
            }

            transition(State.TEARING_DOWN);
            if (runnable) {
                invokeAll(methods.getTeardownMethods(), "Teardown method");
            }

            List<TestCondition> failed = verbalizer.verbalize(examples);
            transition(State.REPORTED);

            report = CycleReport.from(methods.getScenarioName(), methods.isTypeSkipped(),
                methods.getTags(), startedAt, Instant.now(), examples);
            logSummary(report);

            if (!failed.isEmpty()) {
                log.info("ScenarioExecutor: {} failed condition(s) — invoking failure hook", failed.size());
                failureHook.fail();
            }
            return report;
        } finally {
            transition(State.IDLE);
        }
    }

    /**
     * Phase 2 for one compiled, non-skipped example.
     *
     * @throws SpecificationStructureException when the example declared both verify and
     *         named conditions; nothing of the example runs in that case
     */
    public void execute(TestExample example) {
        if (example.isAmbiguous()) {
            throw SpecificationStructureException.ambiguousAssertions(example.getName());
        }

        for (InvokableAction pre : example.getPreActions()) {
            invokeAction(pre, "Pre-action of", example);
        }

        invokeAll(example.getActMethods(), "Act method");

        evaluateConditions(example);

        for (InvokableAction post : example.getPostActions()) {
            invokeAction(post, "Post-action of", example);
        }
        verbalizer.endExample();
    }

    public State             getState()    { return state; }
    public CycleReport       getReport()   { return report; }
    public List<TestExample> getExamples() { return examples; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void evaluateConditions(TestExample example) {
        if (example.hasVerifyCondition() && example.getConditions().isEmpty()) {
            evaluate(example, example.getVerifyCondition(), 1);
            return;
        }

        verbalizer.exampleLine(example.getName());
        for (TestCondition condition : example.getConditions()) {
            evaluate(example, condition, 2);
        }
    }

    private void evaluate(TestExample example, TestCondition condition, int indentLevel) {
        if (example.isSkipped()) {
            condition.record(ConditionStatus.SKIPPED);
        } else if (condition.isPending()) {
            condition.record(ConditionStatus.PENDING);
        } else {
            try {
                condition.invoke();
                if (!condition.hasFailed()) {
                    condition.record(ConditionStatus.PASSED);
                }
            } catch (ActionInvocationException e) {
                condition.failed(e);
                log.debug("ScenarioExecutor: condition '{}' failed: {}",
                    condition.displayName(), e.getCause().toString());
            }
        }
        verbalizer.conditionLine(condition, indentLevel);
    }

    private void invokeAll(List<Method> stepMethods, String step) {
        for (Method method : stepMethods) {
            try {
                method.invoke(scenario);
            } catch (InvocationTargetException e) {
                throw SpecificationExecutionException.from(step, method.getName(), e.getCause());
            } catch (IllegalAccessException e) {
                throw new IllegalStateException(
                    step + " " + method.getDeclaringClass().getName() + "." + method.getName() +
                    " is not accessible.", e);
            }
        }
    }

    private void invokeAction(InvokableAction action, String step, TestExample example) {
        try {
            action.invoke();
        } catch (ActionInvocationException e) {
            throw SpecificationExecutionException.from(step, example.getName(), e.getCause());
        }
    }

    private void transition(State next) {
        log.debug("ScenarioExecutor: {} -> {}", state, next);
        state = next;
    }

    private void logSummary(CycleReport report) {
        log.info("ScenarioExecutor: Complete — examples={}, passed={}, failed={}, pending={}, skipped={}, {}ms",
            report.getExamples().size(), report.getPassed(), report.getFailed(),
            report.getPending(), report.getSkipped(), report.getDurationMillis());
    }
}
