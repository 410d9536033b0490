package com.paygate.gateapi.ratelimit;

import java.time.Duration;
import java.time.Instant;

public interface RateWindowStore {
  /**
   * Opens a new window when none exists or the current one has expired, otherwise increments it.
   * The read-modify-write is atomic per client.
   */
  RateWindow incrementAndGet(String clientId, Instant now, Duration window);

  /** Removes windows that started before {@code staleBefore}; returns the number removed. */
  int evictStale(Instant staleBefore);

  int size();
}
