package com.jmulocity.generic;

import com.jmulocity.common.status.Status;

/** Turns a non-success response into an error status. */
@FunctionalInterface
public interface ErrorDecoder {

  /** The decoder for the platform's standard error payload. */
  ErrorDecoder PLATFORM = RemoteError::toStatus;

  /**
   * Builds the status for a response that did not indicate success.
   *
   * @param body the response body
   * @param httpStatus the HTTP status code
   * @return a non-OK status
   */
  Status fromResponse(byte[] body, int httpStatus);
}
