package com.jmulocity.jsonc;

import com.google.common.collect.ImmutableList;
import com.google.gson.annotations.SerializedName;
import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusOr;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Resolves the fields of a structured record into {@link FieldDescriptor}s.
 *
 * <p>Record components are listed in declaration order. For other classes the declared instance
 * fields of the whole hierarchy are listed, superclass fields first. Static and synthetic fields
 * are never part of the encoded shape.
 *
 * <p>Directive precedence: {@link Omit} (or {@code transient}) beats {@link Flat}, which beats a
 * Gson {@link SerializedName} rename, which beats the declared name.
 */
public final class FieldDescriptors {

  private FieldDescriptors() {
    // Utility class, no instances
  }

  /**
   * Resolves the fields of the given record value.
   *
   * @param record a value whose class is a structured record
   * @return the descriptors in declaration order, or a SCHEMA status if a field cannot be read
   */
  @Nonnull
  public static StatusOr<List<FieldDescriptor>> resolve(@Nonnull Object record) {
    ImmutableList.Builder<FieldDescriptor> descriptors = ImmutableList.builder();
    for (Field field : declaredFields(record.getClass())) {
      if (!field.trySetAccessible()) {
        return StatusOr.ofStatus(
            Status.schema(
                "field '"
                    + field.getName()
                    + "' of "
                    + record.getClass().getName()
                    + " is not accessible"));
      }
      Object value;
      try {
        value = field.get(record);
      } catch (IllegalAccessException e) {
        return StatusOr.ofStatus(
            Status.schema("field '" + field.getName() + "' could not be read: " + e.getMessage()));
      }
      descriptors.add(describe(field, value));
    }
    return StatusOr.ofValue(descriptors.build());
  }

  /** Builds the descriptor of a single field holding the given value. */
  @Nonnull
  static FieldDescriptor describe(Field field, Object value) {
    SerializedName rename = field.getAnnotation(SerializedName.class);
    String outputName = rename != null ? rename.value() : field.getName();
    boolean omitted =
        Modifier.isTransient(field.getModifiers()) || field.isAnnotationPresent(Omit.class);
    return new FieldDescriptor(
        field.getName(),
        field.getType(),
        FieldKind.of(field.getType(), value),
        outputName,
        omitted,
        field.isAnnotationPresent(OmitEmpty.class),
        field.isAnnotationPresent(Flat.class),
        field.isAnnotationPresent(CollectionItems.class),
        value);
  }

  /**
   * Lists the fields that make up the encoded shape of the given type. Annotations placed on record
   * components propagate to these fields, so both record and class declarations are read the same
   * way.
   */
  @Nonnull
  static List<Field> declaredFields(Class<?> type) {
    ImmutableList.Builder<Field> fields = ImmutableList.builder();
    if (type.isRecord()) {
      for (RecordComponent component : type.getRecordComponents()) {
        try {
          fields.add(type.getDeclaredField(component.getName()));
        } catch (NoSuchFieldException e) {
          throw new IllegalStateException(
              "Record " + type.getName() + " has no field for component " + component.getName(),
              e);
        }
      }
      return fields.build();
    }

    Deque<Class<?>> hierarchy = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      hierarchy.push(c);
    }
    for (Class<?> c : hierarchy) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
          continue;
        }
        fields.add(field);
      }
    }
    return fields.build();
  }
}
