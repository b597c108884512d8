package com.speccontext.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Skips every example declared on the annotated scenario type and its subclasses.
 *
 * Skipped examples are still listed in the transcript, each condition reported as
 * {@code skipped}, but no establish / because / act / condition / cleanup code runs.
 * Act methods declared on a skipped type are dropped.
 */
@Inherited
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface Skip {
}
