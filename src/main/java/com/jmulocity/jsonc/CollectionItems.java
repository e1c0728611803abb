package com.jmulocity.jsonc;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the field of a paged collection type that holds the page's items.
 *
 * <p>The encoder only checks that the field is sequence-typed; the marker does not change the
 * encoded shape. {@link com.jmulocity.generic.CollectionDecoder} uses it to locate the items of a
 * decoded page.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface CollectionItems {}
