package com.speccontext.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Focuses a scenario on the tagged example methods.
 *
 * When any example method of a scenario carries {@code @Tag}, only the tagged examples
 * are compiled and run; the others are left out of the cycle entirely. A non-empty
 * value is printed in the {@code Tag(s):} banner at the top of the transcript.
 *
 * <pre>
 *   {@literal @}Tag("overflow")
 *   public void when_adding_past_the_maximum() { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Tag {
    String value() default "";
}
