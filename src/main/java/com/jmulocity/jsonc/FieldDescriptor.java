package com.jmulocity.jsonc;

import javax.annotation.Nullable;

/**
 * The encoder's view of one field of a structured record, resolved from its declaration and its
 * current value.
 *
 * @param declaredName the field's name in the Java source
 * @param declaredType the field's declared type
 * @param kind the kind of the current value, see {@link FieldKind#of}
 * @param outputName the JSON key the field is written under
 * @param omitted whether the field is excluded unconditionally
 * @param omitEmpty whether the field is excluded when its value is empty
 * @param flat whether the field's entries are spliced into the enclosing object
 * @param collectionItems whether the field is marked as a collection's item sequence
 * @param value the field's current value
 */
public record FieldDescriptor(
    String declaredName,
    Class<?> declaredType,
    FieldKind kind,
    String outputName,
    boolean omitted,
    boolean omitEmpty,
    boolean flat,
    boolean collectionItems,
    @Nullable Object value) {}
