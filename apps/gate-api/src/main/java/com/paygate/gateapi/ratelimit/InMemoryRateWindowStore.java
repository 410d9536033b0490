package com.paygate.gateapi.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryRateWindowStore implements RateWindowStore {
  private final ConcurrentMap<String, RateWindow> windows = new ConcurrentHashMap<>();

  @Override
  public RateWindow incrementAndGet(String clientId, Instant now, Duration window) {
    return windows.compute(
        clientId,
        (key, current) ->
            current == null || current.isExpired(now, window)
                ? RateWindow.open(now)
                : current.increment());
  }

  @Override
  public int evictStale(Instant staleBefore) {
    int before = windows.size();
    windows.entrySet().removeIf(entry -> entry.getValue().windowStart().isBefore(staleBefore));
    return Math.max(0, before - windows.size());
  }

  @Override
  public int size() {
    return windows.size();
  }
}
