package com.paygate.gateapi.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FixedWindowRateLimiter {
  private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

  private final RateWindowStore store;
  private final int maxRequests;
  private final Duration window;
  private final boolean enabled;
  private final Clock clock;
  private final AtomicReference<Instant> lastEviction;

  public FixedWindowRateLimiter(RateWindowStore store, RateLimitProperties properties, Clock clock) {
    if (properties.getMaxRequests() <= 0) {
      throw new IllegalArgumentException("rate-limit.max-requests must be > 0");
    }
    if (properties.getWindowSeconds() <= 0) {
      throw new IllegalArgumentException("rate-limit.window-seconds must be > 0");
    }
    this.store = store;
    this.maxRequests = properties.getMaxRequests();
    this.window = Duration.ofSeconds(properties.getWindowSeconds());
    this.enabled = properties.isEnabled();
    this.clock = clock;
    this.lastEviction = new AtomicReference<>(clock.instant());
  }

  public RateLimitDecision admit(String clientId) {
    if (!enabled) {
      return RateLimitDecision.allow(maxRequests);
    }
    Instant now = clock.instant();
    evictIfDue(now);

    RateWindow current = store.incrementAndGet(clientId, now, window);
    if (current.count() <= maxRequests) {
      return RateLimitDecision.allow(maxRequests - current.count());
    }
    long remainingMillis = Duration.between(now, current.windowEnd(window)).toMillis();
    long retryAfterSeconds = (remainingMillis + 999L) / 1000L;
    return RateLimitDecision.deny(retryAfterSeconds);
  }

  public int maxRequests() {
    return maxRequests;
  }

  // Stale means idle for one extra window beyond its own.
  private void evictIfDue(Instant now) {
    Instant previous = lastEviction.get();
    if (now.isBefore(previous.plus(window))) {
      return;
    }
    if (!lastEviction.compareAndSet(previous, now)) {
      return;
    }
    int evicted = store.evictStale(now.minus(window.multipliedBy(2)));
    if (evicted > 0) {
      log.debug("rate windows evicted count={} remaining={}", evicted, store.size());
    }
  }
}
