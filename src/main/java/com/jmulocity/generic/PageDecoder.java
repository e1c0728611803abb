package com.jmulocity.generic;

import com.jmulocity.common.status.StatusOr;

/**
 * Decodes a collection response body.
 *
 * @param <C> the collection type
 */
@FunctionalInterface
public interface PageDecoder<C extends PagedCollection<?>> {

  /**
   * @param body the raw response body of a successful fetch
   * @return the decoded collection, or a DECODE status
   */
  StatusOr<C> decode(byte[] body);
}
