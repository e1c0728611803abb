package com.jmulocity.generic;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusCode;
import com.jmulocity.common.status.StatusOr;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Follows the {@code next} and {@code prev} links of a paginated collection.
 *
 * <p>A page is fetched with the link exactly as the platform issued it. Relative links are handed
 * to the fetcher unchanged; {@link RestClient} resolves them against its base URL. The outcome of
 * a step is one of:
 *
 * <ul>
 *   <li>an error status, if the link is unparsable or not an HTTP URL, the fetch fails, the
 *       platform answers with a non-success status, or the body cannot be decoded;
 *   <li>OK with an empty {@code Optional}, if there is no link or the linked page has no items;
 *   <li>OK with the decoded page otherwise.
 * </ul>
 *
 * <p>The second case deliberately does not distinguish "no link" from "empty page": the platform
 * keeps handing out a {@code next} link on the last page, and following it yields an empty page.
 *
 * <p>Instances hold no mutable state and are safe for concurrent use when the fetcher is.
 *
 * @param <C> the collection type
 */
public final class CollectionPager<C extends PagedCollection<?>> {

  private final PageFetcher fetcher;
  private final PageDecoder<C> decoder;
  private final ErrorDecoder errorDecoder;

  /**
   * Creates a pager that reports non-success responses with the platform's error payload.
   *
   * @param fetcher performs the page requests
   * @param decoder decodes successful response bodies
   */
  public CollectionPager(PageFetcher fetcher, PageDecoder<C> decoder) {
    this(fetcher, decoder, ErrorDecoder.PLATFORM);
  }

  /**
   * Creates a pager.
   *
   * @param fetcher performs the page requests
   * @param decoder decodes successful response bodies
   * @param errorDecoder builds the status for non-success responses
   */
  public CollectionPager(PageFetcher fetcher, PageDecoder<C> decoder, ErrorDecoder errorDecoder) {
    this.fetcher = Preconditions.checkNotNull(fetcher, "fetcher");
    this.decoder = Preconditions.checkNotNull(decoder, "decoder");
    this.errorDecoder = Preconditions.checkNotNull(errorDecoder, "errorDecoder");
  }

  /** Fetches the page after the given one. */
  @Nonnull
  public StatusOr<Optional<C>> nextPage(C collection) {
    return advance(collection, PageLink.NEXT);
  }

  /** Fetches the page before the given one. */
  @Nonnull
  public StatusOr<Optional<C>> previousPage(C collection) {
    return advance(collection, PageLink.PREV);
  }

  /**
   * Fetches the page the selected link of the given collection points to.
   *
   * @param collection the current page
   * @param link which link to follow
   * @return the linked page, empty if there is none, or an error status
   */
  @Nonnull
  public StatusOr<Optional<C>> advance(C collection, PageLink link) {
    if (collection == null) {
      return StatusOr.ofStatus(Status.client("Cannot page from a null collection"));
    }
    String reference = link.select(collection);
    if (Strings.isNullOrEmpty(reference)) {
      Logger.debug("No {} page reference given, no further pages.", link);
      return StatusOr.ofValue(Optional.empty());
    }

    URI uri;
    try {
      uri = new URI(reference);
    } catch (URISyntaxException e) {
      return StatusOr.ofStatus(
          Status.client("Unparsable URL given for page reference: '" + reference + "'"));
    }
    String scheme = uri.getScheme();
    if (scheme != null && (!isHttp(scheme) || uri.getHost() == null)) {
      return StatusOr.ofStatus(
          Status.client("Page reference is not an HTTP URL: '" + reference + "'"));
    }

    PageResponse response;
    try {
      response = fetcher.fetch(uri);
    } catch (IOException e) {
      Logger.error(e, "Fetching page {} failed", reference);
      return StatusOr.ofStatus(
          Status.transport("Error while getting page " + reference + ": " + e.getMessage(), e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return StatusOr.ofStatus(Status.transport("Interrupted while getting page " + reference, e));
    }

    if (!StatusCode.isHttpSuccess(response.status())) {
      Logger.warn("Page {} answered with HTTP {}", reference, response.status());
      Status error = errorDecoder.fromResponse(response.body(), response.status());
      if (error.isOk()) {
        error = RemoteError.toStatus(response.body(), response.status());
      }
      return StatusOr.ofStatus(error);
    }

    StatusOr<C> decodedOr = decoder.decode(response.body());
    if (decodedOr.isNotOk()) {
      return StatusOr.ofStatus(decodedOr.getStatus());
    }

    C page = decodedOr.getValue();
    List<?> items = page.getItems();
    if (items == null || items.isEmpty()) {
      Logger.debug("Page {} is empty, no further pages.", reference);
      return StatusOr.ofValue(Optional.empty());
    }
    return StatusOr.ofValue(Optional.of(page));
  }

  private static boolean isHttp(String scheme) {
    return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
  }
}
