package com.jmulocity.generic;

import java.io.IOException;
import java.net.URI;

/**
 * Fetches one page of a collection. The reference must be requested exactly as given; the
 * platform already encodes page size, page index and filters in it.
 */
@FunctionalInterface
public interface PageFetcher {

  /**
   * Performs the request.
   *
   * @param reference the page URL as issued by the platform, either absolute with an http or https
   *     scheme, or relative to the fetcher's base URL
   * @return the response, whatever its status
   * @throws IOException if the exchange could not be completed
   * @throws InterruptedException if the calling thread was interrupted while waiting
   */
  PageResponse fetch(URI reference) throws IOException, InterruptedException;
}
