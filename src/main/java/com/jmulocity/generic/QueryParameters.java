package com.jmulocity.generic;

import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusOr;
import javax.annotation.Nonnull;

/** Query parameters shared by all collection endpoints. */
public final class QueryParameters {

  /** Smallest page size the platform accepts. */
  public static final int MIN_PAGE_SIZE = 1;

  /** Largest page size the platform accepts. */
  public static final int MAX_PAGE_SIZE = 2000;

  private QueryParameters() {
    // Utility class, no instances
  }

  /**
   * Builds the {@code pageSize} parameter.
   *
   * @param pageSize the number of items per page
   * @return {@code pageSize=<n>}, or a CLIENT status if the size is out of range
   */
  @Nonnull
  public static StatusOr<String> pageSize(int pageSize) {
    if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
      return StatusOr.ofStatus(
          Status.client(
              String.format(
                  "The page size must be between %d and %d, was %d",
                  MIN_PAGE_SIZE, MAX_PAGE_SIZE, pageSize)));
    }
    return StatusOr.ofValue("pageSize=" + pageSize);
  }

  /**
   * Appends the {@code pageSize} parameter to a path that may already carry a query.
   *
   * @param path the request path, e.g. {@code /measurement/measurements?source=4711}
   * @param pageSize the number of items per page
   */
  @Nonnull
  public static StatusOr<String> withPageSize(String path, int pageSize) {
    return pageSize(pageSize)
        .map(parameter -> path + (path.contains("?") ? "&" : "?") + parameter);
  }
}
