package com.paygate.integration.fetch;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public class SsrfGuard {
  private final Set<String> allowedSchemes;
  private final List<String> blockedHostPatterns;

  public SsrfGuard(FetchPolicy policy) {
    Objects.requireNonNull(policy, "policy must not be null");
    this.allowedSchemes = policy.allowedSchemes();
    this.blockedHostPatterns = policy.blockedHostPatterns();
  }

  public boolean isFetchAllowed(String url) {
    try {
      check(url);
      return true;
    } catch (FetchException ex) {
      return false;
    }
  }

  public URI check(String url) {
    if (url == null || url.isBlank()) {
      throw new FetchException(FetchException.Kind.INVALID_URL, "URL is required");
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException ex) {
      throw new FetchException(FetchException.Kind.INVALID_URL, "Invalid URL format", 0, -1, ex);
    }
    return check(uri);
  }

  public URI check(URI uri) {
    if (!uri.isAbsolute() || uri.getScheme() == null) {
      throw new FetchException(FetchException.Kind.INVALID_URL, "URL must be absolute");
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    if (!allowedSchemes.contains(scheme)) {
      throw new FetchException(
          FetchException.Kind.SSRF_BLOCKED, "Only http:// and https:// URLs are allowed");
    }
    String host = normalizedHost(uri);
    if (host == null) {
      throw new FetchException(FetchException.Kind.INVALID_URL, "URL must contain a host");
    }
    for (String pattern : blockedHostPatterns) {
      if (matches(pattern, host)) {
        throw new FetchException(
            FetchException.Kind.SSRF_BLOCKED, "Private/internal URLs are not allowed");
      }
    }
    return uri;
  }

  private static String normalizedHost(URI uri) {
    String host = uri.getHost();
    if (host == null || host.isBlank()) {
      return null;
    }
    String normalized = host.toLowerCase(Locale.ROOT);
    if (normalized.startsWith("[") && normalized.endsWith("]")) {
      normalized = normalized.substring(1, normalized.length() - 1);
    }
    if (normalized.endsWith(".")) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    return normalized;
  }

  // "*.suffix" matches by suffix, "prefix.*" by prefix, anything else exactly.
  static boolean matches(String pattern, String host) {
    if (pattern.startsWith("*")) {
      return host.endsWith(pattern.substring(1));
    }
    if (pattern.endsWith("*")) {
      return host.startsWith(pattern.substring(0, pattern.length() - 1));
    }
    return host.equals(pattern);
  }
}
