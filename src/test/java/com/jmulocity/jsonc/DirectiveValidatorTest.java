package com.jmulocity.jsonc;

import static org.junit.jupiter.api.Assertions.*;

import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusCode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class DirectiveValidatorTest {

  record Holder(@Flat Object extra, @CollectionItems Object items) {}

  record Labelled(@Flat String label) {}

  private static List<FieldDescriptor> describe(Holder holder) {
    return FieldDescriptors.resolve(holder).getValue();
  }

  @Test
  void testRuntimeValueDecidesKind() {
    Status status =
        DirectiveValidator.validate(Holder.class, describe(new Holder(Map.of(), List.of())));

    assertTrue(status.isOk());
  }

  @Test
  void testFlatOnScalarNamesFieldAndKind() {
    Status status =
        DirectiveValidator.validate(Holder.class, describe(new Holder(42, List.of())));

    assertEquals(StatusCode.SCHEMA, status.getCode());
    assertEquals(
        "@Flat on field 'extra' of Holder requires a map or a structured record, "
            + "but the field has kind SCALAR (java.lang.Integer)",
        status.getMessage());
  }

  @Test
  void testCollectionItemsOnMapNamesFieldAndKind() {
    Status status =
        DirectiveValidator.validate(Holder.class, describe(new Holder(Map.of(), Map.of())));

    assertEquals(StatusCode.SCHEMA, status.getCode());
    assertTrue(status.getMessage().startsWith("@CollectionItems on field 'items'"));
    assertTrue(status.getMessage().contains("MAPPING"));
  }

  @Test
  void testNullObjectFieldIsAccepted() {
    Status status = DirectiveValidator.validate(Holder.class, describe(new Holder(null, null)));

    assertTrue(status.isOk(), status.toString());
  }

  @Test
  void testNullValueUsesDeclaredType() {
    List<FieldDescriptor> descriptors = FieldDescriptors.resolve(new Labelled(null)).getValue();

    Status status = DirectiveValidator.validate(Labelled.class, descriptors);

    assertEquals(StatusCode.SCHEMA, status.getCode());
    assertTrue(status.getMessage().contains("(java.lang.String)"));
  }
}
