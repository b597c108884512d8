package com.speccontext.model;

/**
 * Wraps whatever a {@link SpecAction} threw when it was invoked.
 *
 * The original throwable is always the cause. The verbalizer renders the cause's
 * message and stack trace as the failure detail, so an instance without a cause
 * renders with an empty detail.
 */
public class ActionInvocationException extends RuntimeException {

    private ActionInvocationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ActionInvocationException of(Throwable cause) {
        return new ActionInvocationException(
            "Action threw " + cause.getClass().getName() + ": " + cause.getMessage(), cause);
    }
}
