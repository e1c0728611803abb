package com.jmulocity.generic;

import com.google.common.base.Strings;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import com.jmulocity.common.status.Status;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * The platform's error payload ({@value #ERROR_CONTENT_TYPE}), without error details.
 *
 * @param errorType the error category reported by the platform, e.g. {@code
 *     "security/Unauthorized"}
 * @param message a human readable description
 * @param info a link to documentation about the error
 */
public record RemoteError(
    @SerializedName("error") @Nullable String errorType,
    @SerializedName("message") @Nullable String message,
    @SerializedName("info") @Nullable String info) {

  public static final String ERROR_CONTENT_TYPE =
      "application/vnd.com.nsn.cumulocity.error+json";

  private static final Gson GSON = new Gson();

  /** Creates an error raised on the client side, before or instead of a remote call. */
  @Nonnull
  public static RemoteError clientError(String message, String info) {
    return new RemoteError("ClientError", message, info);
  }

  /**
   * Parses an error payload from a response body. Parsing is lenient: an empty or malformed body
   * yields a payload with all fields null, since the HTTP status alone already signals the failure.
   */
  @Nonnull
  public static RemoteError fromResponse(@Nullable byte[] body) {
    if (body == null || body.length == 0) {
      return new RemoteError(null, null, null);
    }
    String text = new String(body, StandardCharsets.UTF_8);
    try {
      RemoteError parsed = GSON.fromJson(text, RemoteError.class);
      return parsed != null ? parsed : new RemoteError(null, null, null);
    } catch (JsonParseException e) {
      Logger.debug(
          "Error response is not a platform error payload: {}",
          Strings.nullToEmpty(e.getMessage()));
      return new RemoteError(null, null, null);
    }
  }

  /**
   * Builds the REMOTE status for a non-success response. Usable as an {@link ErrorDecoder}.
   *
   * @param body the response body
   * @param httpStatus the response's HTTP status code
   */
  @Nonnull
  public static Status toStatus(@Nullable byte[] body, int httpStatus) {
    return Status.remote(httpStatus, fromResponse(body));
  }

  @Override
  public String toString() {
    return String.format("request failed: \"%s\" %s See: %s", errorType, message, info);
  }
}
