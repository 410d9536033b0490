package com.paygate.integration.fetch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class SsrfGuardTest {
  private final SsrfGuard guard = new SsrfGuard(FetchPolicy.defaults());

  @Test
  void shouldAllowPublicHttpAndHttpsUrls() {
    assertTrue(guard.isFetchAllowed("https://example.com"));
    assertTrue(guard.isFetchAllowed("http://example.com/path?q=1"));
    assertEquals("example.com", guard.check("https://example.com/a").getHost());
  }

  @Test
  void shouldBlockLoopbackAndPrivateRanges() {
    assertBlocked("http://127.0.0.1/");
    assertBlocked("http://localhost:8080/admin");
    assertBlocked("http://10.1.2.3/");
    assertBlocked("http://192.168.0.10/");
    assertBlocked("http://172.16.0.1/");
    assertBlocked("http://0.0.0.0/");
    assertBlocked("http://[::1]/");
  }

  @Test
  void shouldBlockCloudMetadataAndInternalSuffixes() {
    assertBlocked("http://169.254.169.254/latest/meta-data");
    assertBlocked("https://svc.internal");
    assertBlocked("https://printer.local/status");
    assertBlocked("https://LOCALHOST./");
  }

  @Test
  void shouldRejectNonHttpSchemes() {
    assertBlocked("ftp://example.com/file");
    assertBlocked("file:///etc/passwd");
  }

  @Test
  void shouldRejectMissingOrRelativeUrls() {
    assertInvalid(null);
    assertInvalid("  ");
    assertInvalid("/relative/path");
    assertInvalid("http://exa mple.com");
    assertFalse(guard.isFetchAllowed("not a url"));
  }

  @Test
  void shouldMatchWildcardPatterns() {
    assertTrue(SsrfGuard.matches("*.internal", "db.internal"));
    assertTrue(SsrfGuard.matches("10.*", "10.0.0.1"));
    assertFalse(SsrfGuard.matches("10.*", "110.0.0.1"));
    assertTrue(SsrfGuard.matches("localhost", "localhost"));
    assertFalse(SsrfGuard.matches("localhost", "localhost.example.com"));
  }

  private void assertBlocked(String url) {
    FetchException ex = assertThrows(FetchException.class, () -> guard.check(url));
    assertEquals(FetchException.Kind.SSRF_BLOCKED, ex.kind(), url);
    assertTrue(ex.isRejectedBeforeNetwork());
  }

  private void assertInvalid(String url) {
    FetchException ex = assertThrows(FetchException.class, () -> guard.check(url));
    assertEquals(FetchException.Kind.INVALID_URL, ex.kind());
  }
}
