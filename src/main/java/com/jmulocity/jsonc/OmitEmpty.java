package com.jmulocity.jsonc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Excludes the annotated field when it holds the empty value of its kind: null, an empty string,
 * zero, {@code false}, {@code '\0'}, an empty {@link java.util.Optional}, or an empty sequence or
 * map.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface OmitEmpty {}
