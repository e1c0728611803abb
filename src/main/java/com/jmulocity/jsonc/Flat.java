package com.jmulocity.jsonc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Splices the entries of the annotated field into the enclosing JSON object instead of nesting
 * them under the field's name.
 *
 * <p>Only valid on fields holding a {@link java.util.Map} or a structured record. Map entries are
 * emitted in the map's iteration order; a record contributes the entries it would render on its
 * own. Flattened entries are written before the enclosing object's regular fields. A null value
 * contributes nothing; if the field is declared with a scalar type it is still rejected.
 *
 * <pre>
 * record NewOperation(
 *     {@literal @}SerializedName("deviceId") String deviceId,
 *     {@literal @}Flat Map&lt;String, Object&gt; additionalFields) {}
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface Flat {}
