package com.paygate.gateapi.ratelimit;

public record RateLimitDecision(boolean allowed, long remaining, long retryAfterSeconds) {
  public static RateLimitDecision allow(long remaining) {
    return new RateLimitDecision(true, Math.max(0L, remaining), 0L);
  }

  public static RateLimitDecision deny(long retryAfterSeconds) {
    return new RateLimitDecision(false, 0L, Math.max(1L, retryAfterSeconds));
  }
}
