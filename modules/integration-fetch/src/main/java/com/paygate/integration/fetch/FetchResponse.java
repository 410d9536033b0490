package com.paygate.integration.fetch;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

public record FetchResponse(
    int statusCode,
    Map<String, List<String>> headers,
    String body,
    URI finalUri,
    int attempts,
    boolean truncated) {
  public FetchResponse {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    body = body == null ? "" : body;
  }

  public FetchResponse(
      int statusCode, Map<String, List<String>> headers, String body, URI finalUri, int attempts) {
    this(statusCode, headers, body, finalUri, attempts, false);
  }

  /** Declared {@code Content-Length}, when the upstream sent a parseable one. */
  public OptionalLong declaredContentLength() {
    Optional<String> value = firstHeader("Content-Length");
    if (value.isEmpty()) {
      return OptionalLong.empty();
    }
    try {
      return OptionalLong.of(Long.parseLong(value.get().trim()));
    } catch (NumberFormatException ex) {
      return OptionalLong.empty();
    }
  }

  public Optional<String> firstHeader(String name) {
    for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
        return Optional.of(entry.getValue().get(0));
      }
    }
    return Optional.empty();
  }

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
