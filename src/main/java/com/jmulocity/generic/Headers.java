package com.jmulocity.generic;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Header maps for the platform's vendor media types. */
public final class Headers {

  public static final String ACCEPT = "Accept";
  public static final String CONTENT_TYPE = "Content-Type";

  private Headers() {
    // Utility class, no instances
  }

  /** No additional headers. */
  public static Map<String, String> empty() {
    return ImmutableMap.of();
  }

  /** An {@code Accept} header for the given media type. */
  public static Map<String, String> accept(String mediaType) {
    return ImmutableMap.of(ACCEPT, mediaType);
  }

  /** A {@code Content-Type} header for the given media type. */
  public static Map<String, String> contentType(String mediaType) {
    return ImmutableMap.of(CONTENT_TYPE, mediaType);
  }

  /** {@code Accept} and {@code Content-Type} headers, as used when creating resources. */
  public static Map<String, String> acceptAndContentType(String accept, String contentType) {
    return ImmutableMap.of(ACCEPT, accept, CONTENT_TYPE, contentType);
  }
}
