package com.speccontext.executor;

/**
 * An arrange, act or teardown method, or an establish / because / cleanup action, threw.
 *
 * Only condition actions take part in the pass/fail model; failures anywhere else abort
 * the cycle and reach the host runner through this exception, with the original cause.
 */
public class SpecificationExecutionException extends RuntimeException {

    private SpecificationExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SpecificationExecutionException from(String step, String name, Throwable cause) {
        return new SpecificationExecutionException(
            String.format("%s '%s' failed: %s", step, name, cause.getMessage()), cause);
    }
}
