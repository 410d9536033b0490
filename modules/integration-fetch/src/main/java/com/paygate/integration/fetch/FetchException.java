package com.paygate.integration.fetch;

public class FetchException extends RuntimeException {
  public enum Kind {
    INVALID_URL,
    SSRF_BLOCKED,
    TIMEOUT,
    NETWORK,
    UPSTREAM_STATUS,
    TOO_MANY_REDIRECTS,
    INTERRUPTED
  }

  private final Kind kind;
  private final int attempts;
  private final int statusCode;

  public FetchException(Kind kind, String message, int attempts, int statusCode, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.attempts = attempts;
    this.statusCode = statusCode;
  }

  public FetchException(Kind kind, String message) {
    this(kind, message, 0, -1, null);
  }

  public Kind kind() {
    return kind;
  }

  public int attempts() {
    return attempts;
  }

  public int statusCode() {
    return statusCode;
  }

  public boolean isRejectedBeforeNetwork() {
    return kind == Kind.INVALID_URL || kind == Kind.SSRF_BLOCKED;
  }
}
