package com.speccontext.executor;

import com.speccontext.model.MethodRole;

/**
 * Signals that an example is written in a way the engine cannot run.
 *
 * This is not an assertion failure: it propagates out of the execution cycle instead of
 * being captured on a condition, so the author sees it immediately.
 *
 * <h3>Causes</h3>
 * <ul>
 *   <li>{@link #unwrappedCode} — the example method body itself threw while its slots were
 *       being harvested. Every observation must sit inside an {@code it(...)} condition or the
 *       {@code verify} slot, because the body only runs to collect deferred work.</li>
 *   <li>{@link #ambiguousAssertions} — the example assigned {@code verify} and also
 *       registered named conditions.</li>
 * </ul>
 */
public class SpecificationStructureException extends RuntimeException {

    private final String exampleName;

    private SpecificationStructureException(String exampleName, String message, Throwable cause) {
        super(message, cause);
        this.exampleName = exampleName;
    }

    public static SpecificationStructureException unwrappedCode(String exampleName, Throwable cause) {
        String normalized = MethodRole.normalize(exampleName);
        return new SpecificationStructureException(exampleName, String.format(
            "The test case example method '%s' has code blocks that are not wrapped in the 'it' or 'verify' " +
            "blocks where variables are being examined before the runner can evaluate all conditions. " +
            "Please enclose those code areas in either the 'it' named test condition block or the 'verify' " +
            "lambda block.", normalized), cause);
    }

    public static SpecificationStructureException ambiguousAssertions(String exampleName) {
        String normalized = MethodRole.normalize(exampleName);
        return new SpecificationStructureException(exampleName, String.format(
            "For the current test example method '%s', the testing scenario should not include a 'verify' " +
            "and named test conditions (i.e. it(\"..\", ...)). Please restructure the test scenario to use " +
            "named test condition(s) or 'verify'.", normalized), null);
    }

    /** The raw name of the offending example method. */
    public String getExampleName() {
        return exampleName;
    }
}
