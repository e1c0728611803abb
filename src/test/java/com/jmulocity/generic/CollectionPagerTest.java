package com.jmulocity.generic;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jmulocity.common.status.Status;
import com.jmulocity.common.status.StatusCode;
import com.jmulocity.common.status.StatusOr;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CollectionPagerTest {

  private static final String NEXT_URL =
      "https://t0815.example.com/audit/auditRecords?pageSize=2&currentPage=2";

  private static final String PAGE_TWO =
      """
      {"self":"https://t0815.example.com/audit/auditRecords?pageSize=2&currentPage=2",
       "next":"https://t0815.example.com/audit/auditRecords?pageSize=2&currentPage=3",
       "statistics":{"pageSize":2,"currentPage":2},
       "auditRecords":[{"id":"3","activity":"Alarm updated","text":"cleared"}]}
      """;

  @Mock private PageFetcher fetcher;

  private CollectionPager<AuditRecordCollection> pager;

  @BeforeEach
  void setUp() {
    pager = new CollectionPager<>(fetcher, CollectionDecoder.of(AuditRecordCollection.class));
  }

  private static AuditRecordCollection firstPage(String next) {
    return new AuditRecordCollection(
        next, null, List.of(new AuditRecord("1", "Alarm created", "raised")));
  }

  @Test
  void testEmptyNextLinkFinishesWithoutFetch() {
    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(""));

    assertTrue(result.isOk(), "Missing link should not be an error");
    assertTrue(result.getValue().isEmpty(), "Missing link should yield no page");
    verifyNoInteractions(fetcher);
  }

  @Test
  void testNullNextLinkFinishesWithoutFetch() {
    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(null));

    assertTrue(result.isOk());
    assertTrue(result.getValue().isEmpty());
    verifyNoInteractions(fetcher);
  }

  @Test
  void testNextPageIsFetchedVerbatim() throws Exception {
    when(fetcher.fetch(URI.create(NEXT_URL))).thenReturn(PageResponse.of(200, PAGE_TWO));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertTrue(result.isOk(), () -> "Unexpected error: " + result.getStatus());
    AuditRecordCollection page = result.getValue().orElseThrow();
    assertEquals(1, page.getItems().size(), "Second page should hold one record");
    assertEquals("3", page.getItems().get(0).id());
    assertEquals(NEXT_URL, page.getSelf());
    assertEquals(2, page.getStatistics().currentPage());
    verify(fetcher).fetch(URI.create(NEXT_URL));
  }

  @Test
  void testEmptyPageFinishes() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(200, "{\"auditRecords\":[]}"));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertTrue(result.isOk());
    assertTrue(result.getValue().isEmpty(), "A page without items ends the traversal");
  }

  @Test
  void testMissingItemsKeyFinishes() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(200, "{\"next\":\"" + NEXT_URL + "\"}"));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertTrue(result.isOk());
    assertTrue(result.getValue().isEmpty());
  }

  @Test
  void testServerErrorIsRemoteError() throws Exception {
    String body =
        "{\"error\":\"general/internalError\",\"message\":\"boom\","
            + "\"info\":\"https://cumulocity.com/guides/reference/rest-implementation\"}";
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(500, body));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertTrue(result.isNotOk());
    Status status = result.getStatus();
    assertEquals(StatusCode.REMOTE, status.getCode());
    assertEquals(500, status.getHttpStatus());
    assertEquals("general/internalError", status.getRemoteError().errorType());
    assertEquals("boom", status.getRemoteError().message());
  }

  @Test
  void testServerErrorWithoutPayload() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(503, "<html>unavailable</html>"));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertEquals(StatusCode.REMOTE, result.getStatus().getCode());
    assertEquals(503, result.getStatus().getHttpStatus());
  }

  @Test
  void testCustomErrorDecoder() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(404, ""));
    CollectionPager<AuditRecordCollection> custom =
        new CollectionPager<>(
            fetcher,
            CollectionDecoder.of(AuditRecordCollection.class),
            (body, httpStatus) -> Status.client("gone: " + httpStatus));

    StatusOr<Optional<AuditRecordCollection>> result = custom.nextPage(firstPage(NEXT_URL));

    assertEquals(Status.client("gone: 404"), result.getStatus());
  }

  @Test
  void testErrorDecoderReturningOkFallsBackToRemote() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(400, ""));
    CollectionPager<AuditRecordCollection> lenient =
        new CollectionPager<>(
            fetcher,
            CollectionDecoder.of(AuditRecordCollection.class),
            (body, httpStatus) -> Status.ok());

    StatusOr<Optional<AuditRecordCollection>> result = lenient.nextPage(firstPage(NEXT_URL));

    assertEquals(StatusCode.REMOTE, result.getStatus().getCode());
    assertEquals(400, result.getStatus().getHttpStatus());
  }

  @Test
  void testTransportFailure() throws Exception {
    IOException failure = new IOException("Connection refused");
    when(fetcher.fetch(any())).thenThrow(failure);

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertEquals(StatusCode.TRANSPORT, result.getStatus().getCode());
    assertSame(failure, result.getStatus().getCause());
    assertTrue(result.getStatus().getMessage().contains(NEXT_URL));
  }

  @Test
  void testInterruptedFetchRestoresFlag() throws Exception {
    when(fetcher.fetch(any())).thenThrow(new InterruptedException());

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertEquals(StatusCode.TRANSPORT, result.getStatus().getCode());
    assertTrue(Thread.interrupted(), "Interrupt flag should be restored");
  }

  @Test
  void testUnparsableLinkIsClientErrorWithoutFetch() {
    StatusOr<Optional<AuditRecordCollection>> result =
        pager.nextPage(firstPage("https://t0815.example.com/audit records?q=|"));

    assertEquals(StatusCode.CLIENT, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().startsWith("Unparsable URL given for page reference"));
    verifyNoInteractions(fetcher);
  }

  @Test
  void testNonHttpLinkIsClientErrorWithoutFetch() {
    StatusOr<Optional<AuditRecordCollection>> result =
        pager.nextPage(firstPage("ftp://t0815.example.com/audit/auditRecords"));

    assertEquals(StatusCode.CLIENT, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().contains("not an HTTP URL"));
    verifyNoInteractions(fetcher);
  }

  @Test
  void testOpaqueLinkIsClientErrorWithoutFetch() {
    StatusOr<Optional<AuditRecordCollection>> result =
        pager.nextPage(firstPage("mailto:support@example.com"));

    assertEquals(StatusCode.CLIENT, result.getStatus().getCode());
    verifyNoInteractions(fetcher);
  }

  @Test
  void testRelativeLinkIsHandedToFetcher() throws Exception {
    String relative = "/audit/auditRecords?pageSize=2&currentPage=2";
    when(fetcher.fetch(URI.create(relative))).thenReturn(PageResponse.of(200, PAGE_TWO));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(relative));

    assertTrue(result.isOk(), () -> "Unexpected error: " + result.getStatus());
    assertTrue(result.getValue().isPresent());
  }

  @Test
  void testMalformedBodyIsDecodeError() throws Exception {
    when(fetcher.fetch(any())).thenReturn(PageResponse.of(200, "{\"auditRecords\":"));

    StatusOr<Optional<AuditRecordCollection>> result = pager.nextPage(firstPage(NEXT_URL));

    assertEquals(StatusCode.DECODE, result.getStatus().getCode());
  }

  @Test
  void testPreviousPage() throws Exception {
    String prevUrl = "https://t0815.example.com/audit/auditRecords?pageSize=2&currentPage=1";
    when(fetcher.fetch(URI.create(prevUrl))).thenReturn(PageResponse.of(200, PAGE_TWO));
    AuditRecordCollection current = new AuditRecordCollection(null, prevUrl, List.of());

    StatusOr<Optional<AuditRecordCollection>> result = pager.previousPage(current);

    assertTrue(result.isOk());
    assertTrue(result.getValue().isPresent());
  }

  @Test
  void testNullCollectionIsClientError() {
    StatusOr<Optional<AuditRecordCollection>> result = pager.advance(null, PageLink.NEXT);

    assertEquals(StatusCode.CLIENT, result.getStatus().getCode());
    verifyNoInteractions(fetcher);
  }
}
