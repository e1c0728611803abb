package com.jmulocity.common.status;

import com.jmulocity.generic.RemoteError;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Represents the outcome of a client operation, possibly with additional error details. Remote
 * failures additionally carry the HTTP status code and the error payload the platform returned.
 */
public class Status {
  /** Marker for statuses that were not produced by an HTTP exchange. */
  public static final int NO_HTTP_STATUS = 0;

  private static final Status OK = new Status(StatusCode.OK, null, null, NO_HTTP_STATUS, null);

  private final StatusCode code;
  private final String message;
  private final Throwable cause;
  private final int httpStatus;
  private final RemoteError remoteError;

  private Status(
      StatusCode code, String message, Throwable cause, int httpStatus, RemoteError remoteError) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
    this.httpStatus = httpStatus;
    this.remoteError = remoteError;
  }

  /** Creates a new status with the given code and message. */
  public static Status of(StatusCode code, String message) {
    return new Status(code, message, null, NO_HTTP_STATUS, null);
  }

  /** Creates a new status with the given code, message, and cause. */
  public static Status of(StatusCode code, String message, Throwable cause) {
    return new Status(code, message, cause, NO_HTTP_STATUS, null);
  }

  /** Returns the OK status. */
  public static Status ok() {
    return OK;
  }

  /** Creates a new CLIENT status for an argument the caller should not have passed. */
  public static Status client(String message) {
    return new Status(StatusCode.CLIENT, message, null, NO_HTTP_STATUS, null);
  }

  /** Creates a new SCHEMA status describing encoder directive misuse. */
  public static Status schema(String message) {
    return new Status(StatusCode.SCHEMA, message, null, NO_HTTP_STATUS, null);
  }

  /** Creates a new TRANSPORT status wrapping the failure that aborted the exchange. */
  public static Status transport(String message, Throwable cause) {
    return new Status(StatusCode.TRANSPORT, message, cause, NO_HTTP_STATUS, null);
  }

  /** Creates a new DECODE status with the given message. */
  public static Status decode(String message) {
    return new Status(StatusCode.DECODE, message, null, NO_HTTP_STATUS, null);
  }

  /** Creates a new DECODE status with the given message and parser failure. */
  public static Status decode(String message, Throwable cause) {
    return new Status(StatusCode.DECODE, message, cause, NO_HTTP_STATUS, null);
  }

  /**
   * Creates a new REMOTE status for a response the platform answered with a non-success code.
   *
   * @param httpStatus the HTTP status code of the response
   * @param remoteError the error payload parsed from the response body
   */
  public static Status remote(int httpStatus, @Nonnull RemoteError remoteError) {
    Objects.requireNonNull(remoteError);
    return new Status(
        StatusCode.REMOTE, remoteError.toString(), null, httpStatus, remoteError);
  }

  /** Returns the code for this status. */
  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  /** Returns the message for this status, or null if there is no message. */
  public String getMessage() {
    return message;
  }

  /** Returns the cause of this status, or null if there is no cause. */
  public Throwable getCause() {
    return cause;
  }

  /** Returns the HTTP status of a REMOTE status, or {@link #NO_HTTP_STATUS}. */
  public int getHttpStatus() {
    return httpStatus;
  }

  /** Returns the platform's error payload for a REMOTE status, or null. */
  @Nullable
  public RemoteError getRemoteError() {
    return remoteError;
  }

  /** Returns true if this status represents an error (i.e., the code is not OK). */
  public boolean isError() {
    return code != StatusCode.OK;
  }

  /** Returns true if this status is OK. */
  public boolean isOk() {
    return code == StatusCode.OK;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(code.toString());
    if (httpStatus != NO_HTTP_STATUS) {
      sb.append(" (HTTP ").append(httpStatus).append(')');
    }
    if (message != null) {
      sb.append(": ").append(message);
    }
    return sb.toString();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && httpStatus == other.httpStatus
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause)
        && Objects.equals(remoteError, other.remoteError);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause, httpStatus, remoteError);
  }
}
