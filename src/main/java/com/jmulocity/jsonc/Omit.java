package com.jmulocity.jsonc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Excludes the annotated field from encoded output unconditionally. Takes precedence over every
 * other directive, {@link Flat} included. Equivalent to declaring a class field {@code transient};
 * records cannot declare transient components, so they use this annotation.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface Omit {}
