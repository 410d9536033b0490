package com.paygate.gateapi.replay;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryReplayStore implements ReplayStore {
  private final ConcurrentMap<String, Instant> consumed = new ConcurrentHashMap<>();

  @Override
  public boolean checkAndInsert(String key, Instant consumedAt) {
    return consumed.putIfAbsent(key, consumedAt) == null;
  }

  @Override
  public boolean contains(String key) {
    return consumed.containsKey(key);
  }

  @Override
  public int size() {
    return consumed.size();
  }
}
