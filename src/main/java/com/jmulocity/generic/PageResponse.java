package com.jmulocity.generic;

import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;

/**
 * A completed HTTP exchange: status code and raw body.
 *
 * @param status the HTTP status code
 * @param body the response body, empty if there was none
 */
public record PageResponse(int status, @Nonnull byte[] body) {

  public PageResponse {
    body = body == null ? new byte[0] : body;
  }

  /** Creates a response with a UTF-8 encoded text body. */
  public static PageResponse of(int status, String body) {
    return new PageResponse(status, body.getBytes(StandardCharsets.UTF_8));
  }

  /** Returns the body decoded as UTF-8. */
  public String bodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "PageResponse{status=" + status + ", bodyLength=" + body.length + "}";
  }
}
