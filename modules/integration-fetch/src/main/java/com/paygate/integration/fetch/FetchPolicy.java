package com.paygate.integration.fetch;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record FetchPolicy(
    Set<String> allowedSchemes,
    List<String> blockedHostPatterns,
    Duration timeout,
    int maxRetries,
    Duration backoff,
    Duration maxBackoff,
    boolean exponentialBackoff,
    int maxRedirects) {
  public static final Set<String> DEFAULT_ALLOWED_SCHEMES = Set.of("http", "https");
  public static final List<String> DEFAULT_BLOCKED_HOST_PATTERNS =
      List.of(
          "localhost",
          "127.*",
          "10.*",
          "192.168.*",
          "172.*",
          "169.254.169.254",
          "*.local",
          "*.internal",
          "0.0.0.0",
          "::1");

  public FetchPolicy {
    if (allowedSchemes == null || allowedSchemes.isEmpty()) {
      throw new IllegalArgumentException("allowedSchemes must not be empty");
    }
    if (blockedHostPatterns == null) {
      throw new IllegalArgumentException("blockedHostPatterns is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (backoff == null || backoff.isNegative()) {
      throw new IllegalArgumentException("backoff must be >= 0");
    }
    if (maxBackoff == null || maxBackoff.compareTo(backoff) < 0) {
      maxBackoff = backoff;
    }
    if (maxRedirects < 0) {
      throw new IllegalArgumentException("maxRedirects must be >= 0");
    }
    allowedSchemes =
        allowedSchemes.stream()
            .map(scheme -> scheme.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    blockedHostPatterns =
        blockedHostPatterns.stream()
            .map(pattern -> pattern.trim().toLowerCase(Locale.ROOT))
            .filter(pattern -> !pattern.isEmpty())
            .toList();
  }

  public static FetchPolicy defaults() {
    return new FetchPolicy(
        DEFAULT_ALLOWED_SCHEMES,
        DEFAULT_BLOCKED_HOST_PATTERNS,
        Duration.ofSeconds(15),
        2,
        Duration.ofMillis(500),
        Duration.ofSeconds(4),
        true,
        5);
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }
}
