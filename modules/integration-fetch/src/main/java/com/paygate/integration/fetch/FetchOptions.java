package com.paygate.integration.fetch;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record FetchOptions(
    String method,
    Map<String, String> headers,
    Duration timeout,
    Integer maxRetries,
    Long maxBodyBytes) {
  public FetchOptions {
    method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
    headers = headers == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (maxRetries != null && maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    if (maxBodyBytes != null && maxBodyBytes <= 0) {
      throw new IllegalArgumentException("maxBodyBytes must be > 0");
    }
  }

  public static FetchOptions get() {
    return new FetchOptions("GET", Map.of(), null, null, null);
  }

  public static FetchOptions get(Map<String, String> headers) {
    return new FetchOptions("GET", headers, null, null, null);
  }

  public FetchOptions withTimeout(Duration value) {
    return new FetchOptions(method, headers, value, maxRetries, maxBodyBytes);
  }

  public FetchOptions withMaxRetries(int value) {
    return new FetchOptions(method, headers, timeout, value, maxBodyBytes);
  }

  public FetchOptions withMaxBodyBytes(long value) {
    return new FetchOptions(method, headers, timeout, maxRetries, value);
  }
}
