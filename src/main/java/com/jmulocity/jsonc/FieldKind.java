package com.jmulocity.jsonc;

import com.google.gson.JsonElement;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;

/** The shape of a field's value as far as the encoder's directives are concerned. */
public enum FieldKind {
  SCALAR,
  MAPPING,
  SEQUENCE,
  RECORD,
  /** An absent {@link Optional}. A present one takes the kind of its content. */
  POINTER;

  /**
   * Determines the kind of a field. The runtime value decides when there is one; a null value
   * falls back to the declared type.
   */
  public static FieldKind of(Class<?> declaredType, @Nullable Object value) {
    if (value == null) {
      return ofType(declaredType);
    }
    if (value instanceof Optional<?> optional) {
      return optional.map(content -> ofType(content.getClass())).orElse(POINTER);
    }
    return ofType(value.getClass());
  }

  /** Determines the kind of values of the given type. */
  public static FieldKind ofType(Class<?> type) {
    if (Optional.class.isAssignableFrom(type)) {
      return POINTER;
    }
    if (Map.class.isAssignableFrom(type)) {
      return MAPPING;
    }
    if (type.isArray() || Collection.class.isAssignableFrom(type)) {
      return SEQUENCE;
    }
    if (isStructuredRecord(type)) {
      return RECORD;
    }
    return SCALAR;
  }

  /**
   * Returns whether values of the given type are encoded field by field: Java records and plain
   * classes that are not part of the JDK or of Gson.
   */
  public static boolean isStructuredRecord(Class<?> type) {
    if (type.isRecord()) {
      return true;
    }
    if (type.isPrimitive() || type.isArray() || type.isInterface()) {
      return false;
    }
    if (Enum.class.isAssignableFrom(type)
        || CharSequence.class.isAssignableFrom(type)
        || Number.class.isAssignableFrom(type)
        || Boolean.class == type
        || Character.class == type
        || Map.class.isAssignableFrom(type)
        || Collection.class.isAssignableFrom(type)
        || Optional.class.isAssignableFrom(type)
        || TemporalAccessor.class.isAssignableFrom(type)
        || Date.class.isAssignableFrom(type)
        || JsonElement.class.isAssignableFrom(type)) {
      return false;
    }
    String name = type.getName();
    return !(name.startsWith("java.")
        || name.startsWith("javax.")
        || name.startsWith("jdk.")
        || name.startsWith("sun."));
  }
}
