package com.speccontext.core;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Orders scenario methods of the same role within one declaring class.
 *
 * Lower values run first. Methods without {@code @Order} use {@link #DEFAULT} and are
 * ordered by name among themselves. Across an inheritance chain, ancestors' methods
 * always run before descendants' methods regardless of this value.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface Order {

    int DEFAULT = Integer.MAX_VALUE / 2;

    int value();
}
