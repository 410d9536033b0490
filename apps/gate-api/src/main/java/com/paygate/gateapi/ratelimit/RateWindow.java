package com.paygate.gateapi.ratelimit;

import java.time.Duration;
import java.time.Instant;

public record RateWindow(Instant windowStart, long count) {
  public RateWindow {
    if (windowStart == null) {
      throw new IllegalArgumentException("windowStart is required");
    }
    if (count < 1) {
      throw new IllegalArgumentException("count must be >= 1");
    }
  }

  public static RateWindow open(Instant now) {
    return new RateWindow(now, 1L);
  }

  public boolean isExpired(Instant now, Duration window) {
    return now.isAfter(windowStart.plus(window));
  }

  public RateWindow increment() {
    return new RateWindow(windowStart, count + 1);
  }

  public Instant windowEnd(Duration window) {
    return windowStart.plus(window);
  }
}
