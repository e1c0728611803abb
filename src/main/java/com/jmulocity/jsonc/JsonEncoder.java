package com.jmulocity.jsonc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusOr;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Encodes structured records into JSON text, honouring the field directives of this package and
 * Gson's {@link com.google.gson.annotations.SerializedName} for renames.
 *
 * <p>Each record is rendered in two passes. Fields marked {@link Flat} come first, in declaration
 * order, each contributing its own entries to the enclosing object. The remaining fields follow in
 * declaration order under their effective names, minus omitted fields and {@link OmitEmpty} fields
 * holding an empty value.
 *
 * <p>When two entries of one object share a key the later one wins and takes the later position.
 * Since the flatten pass runs first, a regular field always overrides a flattened entry of the same
 * name.
 *
 * <p>Scalars are written the usual way: strings, numbers and booleans natively, enums by constant
 * name (or their {@code @SerializedName}), {@link Date} as an ISO-8601 instant, and any other
 * scalar such as a {@code java.time} value or a {@code UUID} by its {@code toString()}.
 */
public final class JsonEncoder {

  private static final Gson GSON =
      new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

  private JsonEncoder() {
    // Utility class, no instances
  }

  /**
   * Encodes a structured record as compact JSON text.
   *
   * @param value the record to encode
   * @return the JSON text, or a SCHEMA status if the value is not a structured record or a
   *     directive is misused anywhere in it
   */
  @Nonnull
  public static StatusOr<String> toJson(@Nullable Object value) {
    return toJsonTree(value).map(GSON::toJson);
  }

  /**
   * Encodes a structured record as a Gson object tree.
   *
   * @param value the record to encode
   * @return the JSON object, or a SCHEMA status
   */
  @Nonnull
  public static StatusOr<JsonObject> toJsonTree(@Nullable Object value) {
    if (value == null || !FieldKind.isStructuredRecord(value.getClass())) {
      String actual = value == null ? "null" : value.getClass().getName();
      return StatusOr.ofStatus(
          Status.schema("only structured records may be serialized, got " + actual));
    }
    return renderRecord(value, "$", newPath());
  }

  private static Set<Object> newPath() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }

  private static StatusOr<JsonObject> renderRecord(
      Object record, String location, Set<Object> path) {
    if (!path.add(record)) {
      return StatusOr.ofStatus(
          Status.schema(
              "reference cycle at " + location + " (" + record.getClass().getName() + ")"));
    }
    try {
      StatusOr<List<FieldDescriptor>> descriptorsOr = FieldDescriptors.resolve(record);
      if (descriptorsOr.isNotOk()) {
        return StatusOr.ofStatus(descriptorsOr.getStatus());
      }
      List<FieldDescriptor> descriptors = descriptorsOr.getValue();

      Status valid = DirectiveValidator.validate(record.getClass(), descriptors);
      if (valid.isError()) {
        return StatusOr.ofStatus(valid);
      }

      List<FieldDescriptor> flat = new ArrayList<>();
      List<FieldDescriptor> regular = new ArrayList<>();
      for (FieldDescriptor descriptor : descriptors) {
        if (descriptor.omitted()) {
          continue;
        }
        (descriptor.flat() ? flat : regular).add(descriptor);
      }

      JsonObject object = new JsonObject();
      for (FieldDescriptor descriptor : flat) {
        Status spliced =
            splice(object, descriptor, location + "." + descriptor.declaredName(), path);
        if (spliced.isError()) {
          return StatusOr.ofStatus(spliced);
        }
      }
      for (FieldDescriptor descriptor : regular) {
        if (descriptor.omitEmpty() && isEmptyValue(descriptor.value())) {
          continue;
        }
        StatusOr<JsonElement> elementOr =
            renderValue(descriptor.value(), location + "." + descriptor.declaredName(), path);
        if (elementOr.isNotOk()) {
          return StatusOr.ofStatus(elementOr.getStatus());
        }
        put(object, descriptor.outputName(), elementOr.getValue());
      }
      return StatusOr.ofValue(object);
    } finally {
      path.remove(record);
    }
  }

  /** Writes the entries of a flattened map or record directly into the enclosing object. */
  private static Status splice(
      JsonObject target, FieldDescriptor descriptor, String location, Set<Object> path) {
    Object value = descriptor.value();
    if (value instanceof Optional<?> optional) {
      value = optional.orElse(null);
    }
    if (value == null) {
      return Status.ok();
    }

    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String key = String.valueOf(entry.getKey());
        StatusOr<JsonElement> elementOr = renderValue(entry.getValue(), location + "." + key, path);
        if (elementOr.isNotOk()) {
          return elementOr.getStatus();
        }
        put(target, key, elementOr.getValue());
      }
      return Status.ok();
    }

    StatusOr<JsonObject> nestedOr = renderRecord(value, location, path);
    if (nestedOr.isNotOk()) {
      return nestedOr.getStatus();
    }
    for (Map.Entry<String, JsonElement> entry : nestedOr.getValue().entrySet()) {
      put(target, entry.getKey(), entry.getValue());
    }
    return Status.ok();
  }

  private static void put(JsonObject target, String key, JsonElement element) {
    if (target.has(key)) {
      Logger.debug("Key '{}' written twice, keeping the later value", key);
      target.remove(key);
    }
    target.add(key, element);
  }

  private static StatusOr<JsonElement> renderValue(
      @Nullable Object value, String location, Set<Object> path) {
    if (value == null) {
      return StatusOr.ofValue(JsonNull.INSTANCE);
    }
    if (value instanceof Optional<?> optional) {
      return renderValue(optional.orElse(null), location, path);
    }
    if (value instanceof JsonElement element) {
      return StatusOr.ofValue(element);
    }
    switch (FieldKind.ofType(value.getClass())) {
      case MAPPING:
        return renderMap((Map<?, ?>) value, location, path);
      case SEQUENCE:
        return renderSequence(value, location, path);
      case RECORD:
        return renderRecord(value, location, path).<JsonElement>map(object -> object);
      default:
        return renderScalar(value, location);
    }
  }

  private static StatusOr<JsonElement> renderMap(Map<?, ?> map, String location, Set<Object> path) {
    if (!path.add(map)) {
      return StatusOr.ofStatus(Status.schema("reference cycle at " + location));
    }
    try {
      JsonObject object = new JsonObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String key = String.valueOf(entry.getKey());
        StatusOr<JsonElement> elementOr = renderValue(entry.getValue(), location + "." + key, path);
        if (elementOr.isNotOk()) {
          return elementOr;
        }
        put(object, key, elementOr.getValue());
      }
      return StatusOr.ofValue(object);
    } finally {
      path.remove(map);
    }
  }

  private static StatusOr<JsonElement> renderSequence(
      Object sequence, String location, Set<Object> path) {
    if (!path.add(sequence)) {
      return StatusOr.ofStatus(Status.schema("reference cycle at " + location));
    }
    try {
      JsonArray array = new JsonArray();
      int index = 0;
      for (Object element : elements(sequence)) {
        StatusOr<JsonElement> elementOr =
            renderValue(element, location + "[" + index++ + "]", path);
        if (elementOr.isNotOk()) {
          return elementOr;
        }
        array.add(elementOr.getValue());
      }
      return StatusOr.ofValue(array);
    } finally {
      path.remove(sequence);
    }
  }

  private static Iterable<?> elements(Object sequence) {
    if (sequence instanceof Collection<?> collection) {
      return collection;
    }
    int length = Array.getLength(sequence);
    List<Object> elements = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      elements.add(Array.get(sequence, i));
    }
    return elements;
  }

  private static StatusOr<JsonElement> renderScalar(Object value, String location) {
    if (value instanceof String s) {
      return StatusOr.ofValue(new JsonPrimitive(s));
    }
    if (value instanceof Boolean b) {
      return StatusOr.ofValue(new JsonPrimitive(b));
    }
    if (value instanceof Character c) {
      return StatusOr.ofValue(new JsonPrimitive(c));
    }
    if (value instanceof Number n) {
      if ((n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue())) {
        return StatusOr.ofStatus(
            Status.schema("non-finite number " + n + " at " + location + " has no JSON form"));
      }
      return StatusOr.ofValue(new JsonPrimitive(n));
    }
    if (value instanceof Enum<?>) {
      return StatusOr.ofValue(GSON.toJsonTree(value));
    }
    if (value instanceof Date date) {
      return StatusOr.ofValue(new JsonPrimitive(Instant.ofEpochMilli(date.getTime()).toString()));
    }
    return StatusOr.ofValue(new JsonPrimitive(value.toString()));
  }

  /**
   * Returns whether a value is the empty value of its kind, the condition under which an {@link
   * OmitEmpty} field is left out.
   */
  public static boolean isEmptyValue(@Nullable Object value) {
    if (value == null) {
      return true;
    }
    if (value instanceof CharSequence s) {
      return s.length() == 0;
    }
    if (value instanceof Boolean b) {
      return !b;
    }
    if (value instanceof Character c) {
      return c == '\0';
    }
    if (value instanceof BigDecimal d) {
      return d.signum() == 0;
    }
    if (value instanceof BigInteger i) {
      return i.signum() == 0;
    }
    if (value instanceof Number n) {
      return n.doubleValue() == 0.0;
    }
    if (value instanceof Optional<?> optional) {
      return optional.isEmpty();
    }
    if (value instanceof Collection<?> collection) {
      return collection.isEmpty();
    }
    if (value instanceof Map<?, ?> map) {
      return map.isEmpty();
    }
    if (value.getClass().isArray()) {
      return Array.getLength(value) == 0;
    }
    return false;
  }
}
