package com.speccontext.testng;

import com.speccontext.core.SpecificationConfig;
import com.speccontext.core.SpecificationContext;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Base class for scenarios run by TestNG.
 *
 * TestNG sees one test per scenario class, {@link #execute()}, which runs the full cycle
 * and fails when any condition failed. The transcript explains which conditions failed
 * and why; the TestNG failure only carries the scenario name.
 *
 * <pre>
 *   public class calculator_specs extends TestNgSpecification {
 *       public void when_adding_two_positive_numbers() { ... }
 *   }
 * </pre>
 *
 *   mvn test -Dtest=calculator_specs
 */
public abstract class TestNgSpecification extends SpecificationContext {

    protected TestNgSpecification() {
        super();
    }

    protected TestNgSpecification(SpecificationConfig config) {
        super(config);
    }

    @Test
    public void execute() {
        executeContext();
    }

    @Override
    protected void failContext() {
        Assert.fail("Specification failed: " + getScenarioMethods().getScenarioName());
    }

    @Override
    protected Class<? extends SpecificationContext> rootType() {
        return TestNgSpecification.class;
    }
}
