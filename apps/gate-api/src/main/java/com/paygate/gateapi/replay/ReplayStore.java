package com.paygate.gateapi.replay;

import java.time.Instant;

/**
 * Records consumed payment proofs. {@link #checkAndInsert} must be a single atomic check-and-set:
 * for concurrent callers with the same key exactly one observes {@code true}. A shared store
 * (database, cache) can replace the in-memory one for multi-instance deployments.
 */
public interface ReplayStore {
  boolean checkAndInsert(String key, Instant consumedAt);

  boolean contains(String key);

  int size();
}
