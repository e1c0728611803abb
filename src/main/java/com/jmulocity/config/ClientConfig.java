package com.jmulocity.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Configuration record for the platform's REST client.
 *
 * @param baseUrl the tenant URL every relative request path is resolved against (e.g.
 *     "https://t0815.cumulocity.com")
 * @param requestTimeout the time a single request may take before it is abandoned
 */
public record ClientConfig(URI baseUrl, Duration requestTimeout) {

  /** Environment variable holding the tenant URL. */
  public static final String BASE_URL_ENV = "C8Y_BASE_URL";

  /** Environment variable holding the request timeout in milliseconds. */
  public static final String REQUEST_TIMEOUT_ENV = "C8Y_REQUEST_TIMEOUT_MS";

  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  public ClientConfig {
    Preconditions.checkNotNull(baseUrl, "baseUrl");
    Preconditions.checkArgument(baseUrl.isAbsolute(), "baseUrl must be absolute: %s", baseUrl);
    requestTimeout = requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout;
    Preconditions.checkArgument(
        !requestTimeout.isNegative() && !requestTimeout.isZero(),
        "requestTimeout must be positive: %s",
        requestTimeout);
  }

  /** Creates a configuration with the default request timeout. */
  @Nonnull
  public static ClientConfig of(String baseUrl) {
    return new ClientConfig(URI.create(baseUrl), DEFAULT_REQUEST_TIMEOUT);
  }

  /** Reads the configuration from the process environment. */
  @Nonnull
  public static ClientConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from the given environment map.
   *
   * @throws IllegalArgumentException if {@value #BASE_URL_ENV} is missing or a value is malformed
   */
  @Nonnull
  public static ClientConfig fromEnvironment(Map<String, String> environment) {
    String baseUrl = environment.get(BASE_URL_ENV);
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(baseUrl), "Environment variable %s is not set", BASE_URL_ENV);

    Duration timeout = DEFAULT_REQUEST_TIMEOUT;
    String timeoutMillis = environment.get(REQUEST_TIMEOUT_ENV);
    if (!Strings.isNullOrEmpty(timeoutMillis)) {
      try {
        timeout = Duration.ofMillis(Long.parseLong(timeoutMillis.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            REQUEST_TIMEOUT_ENV + " must be a number of milliseconds, was '" + timeoutMillis + "'",
            e);
      }
    }
    return new ClientConfig(URI.create(baseUrl), timeout);
  }

  /**
   * Resolves a request path against the base URL. Absolute URLs, such as the page links the
   * platform hands out, are returned unchanged.
   *
   * @throws IllegalArgumentException if {@code pathOrUrl} is not a valid URI reference
   */
  @Nonnull
  public URI resolve(String pathOrUrl) {
    URI target = URI.create(pathOrUrl);
    if (target.isAbsolute()) {
      return target;
    }
    String base = baseUrl.toString();
    if (base.endsWith("/") && pathOrUrl.startsWith("/")) {
      return URI.create(base.substring(0, base.length() - 1) + pathOrUrl);
    }
    if (!base.endsWith("/") && !pathOrUrl.startsWith("/")) {
      return URI.create(base + "/" + pathOrUrl);
    }
    return URI.create(base + pathOrUrl);
  }

  /** Resolves an already parsed reference against the base URL, see {@link #resolve(String)}. */
  @Nonnull
  public URI resolve(URI reference) {
    return reference.isAbsolute() ? reference : resolve(reference.toString());
  }

  /** Returns a string representation of this configuration, safe to log. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("baseUrl", baseUrl)
        .add("requestTimeout", requestTimeout)
        .toString();
  }
}
