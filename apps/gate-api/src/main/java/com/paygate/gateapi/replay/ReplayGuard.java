package com.paygate.gateapi.replay;

import com.paygate.domain.payment.Network;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ReplayGuard {
  private static final Logger log = LoggerFactory.getLogger(ReplayGuard.class);

  private final ReplayStore store;
  private final Clock clock;

  public ReplayGuard(ReplayStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public ConsumeResult consume(Network network, String transactionId) {
    if (network == null || transactionId == null || transactionId.isBlank()) {
      throw new IllegalArgumentException("network and transactionId are required");
    }
    if (store.checkAndInsert(key(network, transactionId), clock.instant())) {
      return ConsumeResult.FIRST_USE;
    }
    log.info("payment proof replay rejected network={} tx={}", network.wireName(), transactionId);
    return ConsumeResult.ALREADY_USED;
  }

  // Base hashes are hex and case-insensitive; Solana signatures are case-sensitive base58.
  static String key(Network network, String transactionId) {
    String id = transactionId.trim();
    if (network == Network.BASE) {
      id = id.toLowerCase(Locale.ROOT);
    }
    return network.wireName() + ":" + id;
  }
}
