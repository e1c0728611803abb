package com.jmulocity.generic;

import com.google.common.base.Preconditions;
import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusOr;
import com.jmulocity.config.ClientConfig;
import com.jmulocity.jsonc.JsonEncoder;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Thin REST transport for the platform, on top of the JDK {@link HttpClient}.
 *
 * <p>Relative paths are resolved against {@link ClientConfig#baseUrl()}; absolute URLs are used
 * verbatim. A path that is not a valid URI reference is rejected with an {@link
 * IllegalArgumentException}. Every method returns the response whatever its status; interpreting
 * non-success codes is left to the caller. As a {@link PageFetcher} it issues plain GET requests, see {@link
 * #pageFetcher(String)} for collection endpoints that want a specific media type.
 */
public class RestClient implements PageFetcher {

  private final ClientConfig config;
  private final HttpClient httpClient;

  /** Creates a client with a default JDK HTTP client. */
  public RestClient(ClientConfig config) {
    this(config, HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build());
  }

  /** Creates a client sharing an existing JDK HTTP client. */
  public RestClient(ClientConfig config, HttpClient httpClient) {
    this.config = Preconditions.checkNotNull(config, "config");
    this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
    Logger.info("Created REST client: {}", config.toSecureString());
  }

  /** Returns the configuration of this client. */
  public ClientConfig config() {
    return config;
  }

  /** Fetches a page; a relative reference is resolved against the base URL. */
  @Override
  public PageResponse fetch(URI reference) throws IOException, InterruptedException {
    return send("GET", config.resolve(reference), null, Headers.empty());
  }

  /**
   * Returns a page fetcher that asks for the given collection media type.
   *
   * @param collectionMediaType the collection's vendor media type, e.g. {@code
   *     application/vnd.com.nsn.cumulocity.measurementCollection+json}
   */
  public PageFetcher pageFetcher(String collectionMediaType) {
    Map<String, String> headers = Headers.accept(collectionMediaType);
    return reference -> send("GET", config.resolve(reference), null, headers);
  }

  public PageResponse get(String path, Map<String, String> headers)
      throws IOException, InterruptedException {
    return send("GET", config.resolve(path), null, headers);
  }

  public PageResponse post(String path, byte[] body, Map<String, String> headers)
      throws IOException, InterruptedException {
    return send("POST", config.resolve(path), body, headers);
  }

  public PageResponse put(String path, byte[] body, Map<String, String> headers)
      throws IOException, InterruptedException {
    return send("PUT", config.resolve(path), body, headers);
  }

  public PageResponse delete(String path, Map<String, String> headers)
      throws IOException, InterruptedException {
    return send("DELETE", config.resolve(path), null, headers);
  }

  /**
   * Encodes a structured record with {@link JsonEncoder} and posts it.
   *
   * @param path the request path
   * @param record the request body
   * @param headers additional headers, typically {@link Headers#acceptAndContentType}
   * @return the response, a SCHEMA status if the record cannot be encoded, a CLIENT status if the
   *     path is not a valid URI reference, or a TRANSPORT status
   */
  @Nonnull
  public StatusOr<PageResponse> postJson(String path, Object record, Map<String, String> headers) {
    StatusOr<String> jsonOr = JsonEncoder.toJson(record);
    if (jsonOr.isNotOk()) {
      return StatusOr.ofStatus(jsonOr.getStatus());
    }
    URI uri;
    try {
      uri = config.resolve(path);
    } catch (IllegalArgumentException e) {
      return StatusOr.ofStatus(
          Status.client("Invalid request path '" + path + "': " + e.getMessage()));
    }
    try {
      return StatusOr.ofValue(
          send("POST", uri, jsonOr.getValue().getBytes(StandardCharsets.UTF_8), headers));
    } catch (IOException e) {
      Logger.error(e, "POST {} failed", path);
      return StatusOr.ofStatus(
          Status.transport("Error while posting to " + path + ": " + e.getMessage(), e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return StatusOr.ofStatus(Status.transport("Interrupted while posting to " + path, e));
    }
  }

  private PageResponse send(
      String method, URI uri, @Nullable byte[] body, Map<String, String> headers)
      throws IOException, InterruptedException {
    HttpRequest.BodyPublisher publisher =
        body == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofByteArray(body);
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri).timeout(config.requestTimeout()).method(method, publisher);
    headers.forEach(builder::header);

    Logger.debug("{} {}", method, uri);
    HttpResponse<byte[]> response =
        httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    return new PageResponse(response.statusCode(), response.body());
  }
}
