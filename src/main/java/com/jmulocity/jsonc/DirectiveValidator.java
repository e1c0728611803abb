package com.jmulocity.jsonc;

import com.jmulocity.common.status.Status;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Checks that kind-restricted directives sit on fields of a compatible kind.
 *
 * <ul>
 *   <li>{@link Flat} requires a MAPPING or RECORD value.
 *   <li>{@link CollectionItems} requires a SEQUENCE value.
 * </ul>
 *
 * <p>Fields excluded with {@link Omit} are never looked at. Validation happens against the value
 * being encoded, not at declaration time, so a field declared as {@code Object} is accepted as long
 * as it currently holds a map or a record, or holds null. A null field with a more specific
 * declared type is checked against that type.
 */
public final class DirectiveValidator {

  private DirectiveValidator() {
    // Utility class, no instances
  }

  /**
   * Validates all descriptors of one record.
   *
   * @param owner the record type the descriptors were resolved from, used in messages
   * @param descriptors the resolved fields
   * @return OK, or a SCHEMA status naming the first offending field and its kind
   */
  @Nonnull
  public static Status validate(Class<?> owner, List<FieldDescriptor> descriptors) {
    for (FieldDescriptor descriptor : descriptors) {
      Status status = validate(owner, descriptor);
      if (status.isError()) {
        return status;
      }
    }
    return Status.ok();
  }

  /** Validates a single descriptor. */
  @Nonnull
  public static Status validate(Class<?> owner, FieldDescriptor descriptor) {
    if (descriptor.omitted()) {
      return Status.ok();
    }
    if (descriptor.value() == null && descriptor.declaredType() == Object.class) {
      // Nothing to splice, and no type to check against.
      return Status.ok();
    }
    if (descriptor.flat()
        && descriptor.kind() != FieldKind.MAPPING
        && descriptor.kind() != FieldKind.RECORD) {
      return Status.schema(misuse(owner, descriptor, "@Flat", "a map or a structured record"));
    }
    if (descriptor.collectionItems() && descriptor.kind() != FieldKind.SEQUENCE) {
      return Status.schema(misuse(owner, descriptor, "@CollectionItems", "a sequence"));
    }
    return Status.ok();
  }

  private static String misuse(
      Class<?> owner, FieldDescriptor descriptor, String directive, String expected) {
    Class<?> actualType =
        descriptor.value() != null ? descriptor.value().getClass() : descriptor.declaredType();
    return String.format(
        "%s on field '%s' of %s requires %s, but the field has kind %s (%s)",
        directive,
        descriptor.declaredName(),
        owner.getSimpleName(),
        expected,
        descriptor.kind(),
        actualType.getName());
  }
}
