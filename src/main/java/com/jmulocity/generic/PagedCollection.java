package com.jmulocity.generic;

import java.util.List;
import javax.annotation.Nullable;

/**
 * One page of a paginated platform collection. Implementations are immutable snapshots of a
 * response; callers keep them to read the items and to follow the {@code next}/{@code prev} links
 * with a {@link CollectionPager}.
 *
 * @param <T> the item type
 */
public interface PagedCollection<T> {

  /** The URL this page was fetched from. */
  @Nullable
  String getSelf();

  /** The URL of the following page, or null/empty if there is none. */
  @Nullable
  String getNext();

  /** The URL of the preceding page, or null/empty if there is none. */
  @Nullable
  String getPrev();

  /** The items on this page, never null once decoded by {@link CollectionDecoder}. */
  List<T> getItems();

  /** Paging statistics, if the response carried them. */
  @Nullable
  PagingStatistics getStatistics();
}
