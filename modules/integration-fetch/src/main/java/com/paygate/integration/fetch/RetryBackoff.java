package com.paygate.integration.fetch;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class RetryBackoff {
  private final long baseBackoffMs;
  private final long maxBackoffMs;
  private final boolean exponential;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public RetryBackoff(long baseBackoffMs, long maxBackoffMs, boolean exponential) {
    this(baseBackoffMs, maxBackoffMs, exponential, false, () -> 1.0d);
  }

  public RetryBackoff(
      long baseBackoffMs,
      long maxBackoffMs,
      boolean exponential,
      boolean jitterEnabled,
      DoubleSupplier jitterSource) {
    this.baseBackoffMs = Math.max(0L, baseBackoffMs);
    this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
    this.exponential = exponential;
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public static RetryBackoff forPolicy(FetchPolicy policy) {
    return new RetryBackoff(
        policy.backoff().toMillis(), policy.maxBackoff().toMillis(), policy.exponentialBackoff());
  }

  public static RetryBackoff jittered(long baseBackoffMs, long maxBackoffMs) {
    return new RetryBackoff(
        baseBackoffMs, maxBackoffMs, true, true, () -> ThreadLocalRandom.current().nextDouble());
  }

  /** Delay to wait after the given failed attempt (1-based) before the next one. */
  public Duration delayAfterAttempt(int attempt) {
    long deterministic = deterministicDelay(attempt);
    if (!jitterEnabled || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    long jittered = (long) Math.floor(factor * (deterministic + 1L));
    return Duration.ofMillis(Math.max(0L, Math.min(maxBackoffMs, jittered)));
  }

  private long deterministicDelay(int attempt) {
    if (baseBackoffMs == 0L) {
      return 0L;
    }
    if (!exponential) {
      return baseBackoffMs;
    }
    int exponent = Math.max(0, attempt - 1);
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    return Math.max(0L, (long) Math.floor(Math.min((double) maxBackoffMs, scaled)));
  }
}
