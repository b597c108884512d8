package com.speccontext.core;

import com.speccontext.executor.CompilationContext;
import com.speccontext.executor.MethodClassifier;
import com.speccontext.executor.ScenarioCompiler;
import com.speccontext.executor.ScenarioExecutor;
import com.speccontext.model.ScenarioMethods;
import com.speccontext.model.SpecAction;
import com.speccontext.model.TestCondition;
import com.speccontext.report.CycleReport;
import com.speccontext.report.Verbalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Base class for a scenario: every behavior of one subject, described by convention-named
 * methods.
 *
 * <h3>Writing a scenario</h3>
 * <pre>
 *   public class calculator_specs extends TestNgSpecification {
 *       private Calculator calculator;
 *       private int result;
 *
 *       public void given_a_calculator() { calculator = new Calculator(); }
 *
 *       public void when_adding_two_positive_numbers() {
 *           establish = () -&gt; result = 0;
 *           because   = () -&gt; result = calculator.add(1, 2);
 *           it("should equal 3", () -&gt; assertThat(result).isEqualTo(3));
 *       }
 *
 *       public void it_should_start_at_zero() {
 *           verify = () -&gt; assertThat(calculator.total()).isZero();
 *       }
 *   }
 * </pre>
 *
 * Method roles come from name prefixes (see {@link com.speccontext.model.MethodRole}). An
 * example method runs once per cycle only to assign the slots below and register named
 * conditions; all observation code must live inside those deferred actions.
 *
 * <h3>Slots</h3>
 * <ul>
 *   <li>{@link #establish} — sets up the context of the example</li>
 *   <li>{@link #because} — the action under test</li>
 *   <li>{@link #verify} — a single unnamed assertion, reported under the example's name</li>
 *   <li>{@link #cleanup} — restores anything the example changed</li>
 * </ul>
 *
 * Use either {@code verify} or {@code it(...)} in one example, never both.
 *
 * <h3>Lifecycle</h3>
 * Method classification happens at construction and is cached per type. Every call to
 * {@link #executeContext()} runs one full cycle under an instance lock and then resets the
 * slots, so an instance can be executed again.
 */
public abstract class SpecificationContext {

    private static final Logger log = LoggerFactory.getLogger(SpecificationContext.class);

    /** Bind a condition to this to mark it pending: reported, never invoked. */
    public static final SpecAction PENDING = SpecAction.PENDING;

    /** Action to set up the initial context of an example. */
    protected SpecAction establish;

    /** Action under test, run after {@link #establish}. */
    protected SpecAction because;

    /** Unnamed assertion for the example; excludes named conditions. */
    protected SpecAction verify;

    /** Action restoring anything the example affected. */
    protected SpecAction cleanup;

    private final List<TestCondition> conditions  = new ArrayList<>();
    private final ReentrantLock       executeLock = new ReentrantLock();

    private final SpecificationConfig config;
    private final ScenarioMethods     methods;
    private final Verbalizer          verbalizer;

    private volatile CycleReport lastReport;

    protected SpecificationContext() {
        this(SpecificationConfig.fromEnvironment());
    }

    protected SpecificationContext(SpecificationConfig config) {
        this.config     = config;
        this.methods    = MethodClassifier.classify(getClass(), rootType(), config.isLegacyInheritanceOrder());
        this.verbalizer = new Verbalizer(config.getTranscriptSink(), config.getStackFrameLimit());
    }

    // ── Named conditions ──────────────────────────────────────────────────────

    /**
     * Registers a named condition for the example method currently being compiled.
     * The name reads as a sentence after "it", e.g. {@code it("should equal 3", ...)}.
     */
    protected void it(String name, SpecAction action) {
        conditions.add(TestCondition.named(name, action));
    }

    /** Registers a pending condition: listed in the transcript, never invoked. */
    protected void it(String name) {
        it(name, PENDING);
    }

    // ── Execution cycle ───────────────────────────────────────────────────────

    /**
     * Runs one full cycle: arrange, every selected example, teardown, transcript, and the
     * failure hook if any condition failed. Concurrent callers on the same instance run one
     * after the other.
     *
     * @throws IllegalStateException when called from inside a running cycle of this instance
     * @throws com.speccontext.executor.SpecificationStructureException  an example is malformed
     * @throws com.speccontext.executor.SpecificationExecutionException  a non-condition step threw
     */
    protected void executeContext() {
        if (executeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException(
                "Scenario " + getClass().getName() + " is already executing on this thread");
        }

        executeLock.lock();
        ScenarioExecutor executor = null;
        try {
            resetContext();
            executor = new ScenarioExecutor(
                this, methods, new ScenarioCompiler(this, new SlotContext()), verbalizer, this::failContext);
            executor.run();
        } finally {
            if (executor != null && executor.getReport() != null) {
                lastReport = executor.getReport();
                if (config.isJsonReport()) {
                    log.info("SpecificationContext: cycle report\n{}", lastReport.toJson());
                }
            }
            resetContext();
            executeLock.unlock();
        }
    }

    /**
     * Failure hook, called once at the end of a cycle in which at least one condition failed.
     * Runner adapters override it to raise their framework's failure.
     */
    protected void failContext() {
        log.error("Specification failed: {}", methods.getScenarioName());
    }

    /**
     * The abstract base below which scenario methods are discovered. Adapters that add their
     * own base class return it here so it counts as the root for ordering.
     */
    protected Class<? extends SpecificationContext> rootType() {
        return SpecificationContext.class;
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /** Report of the most recent completed cycle, or {@code null} before the first one. */
    public CycleReport lastReport() {
        return lastReport;
    }

    public ScenarioMethods getScenarioMethods() {
        return methods;
    }

    public SpecificationConfig getConfig() {
        return config;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void resetContext() {
        establish = null;
        because   = null;
        verify    = null;
        cleanup   = null;
        conditions.clear();
        verbalizer.clear();
    }

    private final class SlotContext implements CompilationContext {

        @Override public SpecAction establish() { return establish; }
        @Override public SpecAction because()   { return because; }
        @Override public SpecAction verify()    { return verify; }
        @Override public SpecAction cleanup()   { return cleanup; }

        @Override
        public List<TestCondition> conditions() {
            return List.copyOf(conditions);
        }

        @Override
        public void reset() {
            establish = null;
            because   = null;
            verify    = null;
            cleanup   = null;
            conditions.clear();
        }
    }
}
