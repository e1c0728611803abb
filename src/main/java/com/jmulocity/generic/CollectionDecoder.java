package com.jmulocity.generic;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusOr;
import com.jmulocity.jsonc.CollectionItems;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Decodes collection responses into a typed {@link PagedCollection}.
 *
 * <p>The collection type must declare exactly one {@link CollectionItems} field of a {@code List}
 * type. A response without the items key decodes to an empty item list rather than null, which the
 * pager reads as "no further pages". Record collection types cannot be patched after construction
 * and are expected to default a missing item list in their compact constructor.
 *
 * @param <C> the collection type
 */
public final class CollectionDecoder<C extends PagedCollection<?>> implements PageDecoder<C> {

  private final Class<C> collectionType;
  private final Field itemsField;
  private final Gson gson;

  private CollectionDecoder(Class<C> collectionType, Field itemsField, Gson gson) {
    this.collectionType = collectionType;
    this.itemsField = itemsField;
    this.gson = gson;
  }

  /**
   * Creates a decoder for the given collection type.
   *
   * @throws IllegalArgumentException if the type does not have exactly one {@link CollectionItems}
   *     list field
   */
  @Nonnull
  public static <C extends PagedCollection<?>> CollectionDecoder<C> of(Class<C> collectionType) {
    return of(collectionType, new Gson());
  }

  /** Creates a decoder using a customized Gson instance, e.g. with extra type adapters. */
  @Nonnull
  public static <C extends PagedCollection<?>> CollectionDecoder<C> of(
      Class<C> collectionType, Gson gson) {
    Preconditions.checkNotNull(collectionType, "collectionType");
    Preconditions.checkNotNull(gson, "gson");
    return new CollectionDecoder<>(collectionType, findItemsField(collectionType), gson);
  }

  private static Field findItemsField(Class<?> collectionType) {
    Field found = null;
    for (Class<?> c = collectionType; c != null && c != Object.class; c = c.getSuperclass()) {
      for (Field field : c.getDeclaredFields()) {
        if (Modifier.isStatic(field.getModifiers())
            || !field.isAnnotationPresent(CollectionItems.class)) {
          continue;
        }
        Preconditions.checkArgument(
            found == null,
            "%s declares more than one @CollectionItems field",
            collectionType.getName());
        Preconditions.checkArgument(
            List.class.isAssignableFrom(field.getType()),
            "@CollectionItems field '%s' of %s must be a List, but is %s",
            field.getName(),
            collectionType.getName(),
            field.getType().getName());
        found = field;
      }
    }
    Preconditions.checkArgument(
        found != null, "%s declares no @CollectionItems field", collectionType.getName());
    found.setAccessible(true);
    return found;
  }

  /** Returns the collection type this decoder produces. */
  public Class<C> collectionType() {
    return collectionType;
  }

  /**
   * Decodes a response body.
   *
   * @param body the raw response body
   * @return the collection, or a DECODE status if the body is empty or not a valid collection
   */
  @Nonnull
  @Override
  public StatusOr<C> decode(byte[] body) {
    if (body == null || body.length == 0) {
      return StatusOr.ofStatus(Status.decode("Response body was empty"));
    }

    C collection;
    try {
      collection = gson.fromJson(new String(body, StandardCharsets.UTF_8), collectionType);
    } catch (JsonParseException e) {
      return StatusOr.ofStatus(
          Status.decode("Error while parsing response JSON: " + e.getMessage(), e));
    }
    if (collection == null) {
      return StatusOr.ofStatus(Status.decode("Response body did not contain a collection"));
    }

    if (collectionType.isRecord()) {
      // Record components are final; records normalize their items in the compact constructor.
      return StatusOr.ofValue(collection);
    }
    try {
      if (itemsField.get(collection) == null) {
        itemsField.set(collection, new ArrayList<>());
      }
    } catch (IllegalAccessException e) {
      return StatusOr.ofStatus(
          Status.decode("Could not access items of " + collectionType.getSimpleName(), e));
    }
    return StatusOr.ofValue(collection);
  }
}
