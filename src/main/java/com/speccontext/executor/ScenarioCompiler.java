package com.speccontext.executor;

import com.speccontext.model.MethodRole;
import com.speccontext.model.SpecAction;
import com.speccontext.model.TestCondition;
import com.speccontext.model.TestExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.List;

/**
 * Phase 1 of the two-phase protocol: turns one example method into a {@link TestExample}.
 *
 * The example method is invoked exactly once, with its slots and condition registry
 * cleared beforehand. Whatever it assigned and registered is frozen into the example:
 *
 *   establish  → pre-action 1
 *   because    → pre-action 2
 *   verify     → a single headline condition named after the example
 *   it(...)    → named conditions, in registration order
 *   cleanup    → post-action
 *
 * Nothing harvested is run here; that is the executor's job (phase 2).
 *
 * A skipped example whose body throws keeps whatever it harvested before the throw. When
 * that is nothing, it gets a single headline condition named after the example.
 */
public class ScenarioCompiler {

    private static final Logger log = LoggerFactory.getLogger(ScenarioCompiler.class);

    private final Object             scenario;
    private final CompilationContext context;

    public ScenarioCompiler(Object scenario, CompilationContext context) {
        this.scenario = scenario;
        this.context  = context;
    }

    /**
     * Invokes {@code exampleMethod} on the scenario and compiles what it declared.
     *
     * @param exampleMethod a method classified as {@link MethodRole#EXAMPLE}
     * @param skipped       the example's declaring type is skipped
     * @param actMethods    the scenario's act methods, shared by every example
     * @throws SpecificationStructureException when the body of a non-skipped example throws
     */
    public TestExample compile(Method exampleMethod, boolean skipped, List<Method> actMethods) {
        String name = exampleMethod.getName();
        context.reset();

        boolean harvestFailed = false;
        try {
            exampleMethod.invoke(scenario);
        } catch (InvocationTargetException e) {
            if (!skipped) {
                context.reset();
                throw SpecificationStructureException.unwrappedCode(name, e.getCause());
            }
            // arrange does not run for skipped scenarios, so their bodies may see unset fields
            harvestFailed = true;
            log.debug("ScenarioCompiler: skipped example {} threw while compiling: {}",
                name, e.getCause().toString());
        } catch (IllegalAccessException e) {
            context.reset();
            throw new IllegalStateException(
                "Example method " + exampleMethod.getDeclaringClass().getName() + "." + name +
                " is not accessible.", e);
        }

        TestExample.Builder builder = TestExample.builder(name)
            .skipped(skipped)
            .actMethods(actMethods)
            .conditions(context.conditions());

        SpecAction verify = context.verify();
        if (verify != null) {
            builder.verifyCondition(TestCondition.verifying(MethodRole.normalize(name), verify));
        } else if (harvestFailed && context.conditions().isEmpty()) {
            // nothing harvested: report the example itself as one skipped line
            builder.verifyCondition(TestCondition.verifying(MethodRole.normalize(name), null));
        }
        if (context.establish() != null) builder.preAction(context.establish());
        if (context.because() != null)   builder.preAction(context.because());
        if (context.cleanup() != null)   builder.postAction(context.cleanup());

        context.reset();

        TestExample example = builder.build();
        if (example.isAmbiguous()) {
            log.warn("ScenarioCompiler: {} declares both verify and {} named condition(s)",
                name, example.getConditions().size());
        }
        log.debug("ScenarioCompiler: compiled {}", example);
        return example;
    }
}
