package com.jmulocity.generic;

import java.util.function.Function;

/** Selects which link of a {@link PagedCollection} to follow. */
public enum PageLink {
  NEXT(PagedCollection::getNext),
  PREV(PagedCollection::getPrev);

  private final Function<PagedCollection<?>, String> selector;

  PageLink(Function<PagedCollection<?>, String> selector) {
    this.selector = selector;
  }

  /** Returns the selected link of the collection, possibly null or empty. */
  public String select(PagedCollection<?> collection) {
    return selector.apply(collection);
  }
}
