package com.paygate.domain.payment;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public enum Network {
  SOLANA("solana", Pattern.compile("^[1-9A-HJ-NP-Za-km-z]{86,88}$")),
  BASE("base", Pattern.compile("^0x[0-9a-fA-F]{64}$"));

  private final String wireName;
  private final Pattern transactionIdShape;

  Network(String wireName, Pattern transactionIdShape) {
    this.wireName = wireName;
    this.transactionIdShape = transactionIdShape;
  }

  public String wireName() {
    return wireName;
  }

  public boolean matchesTransactionId(String transactionId) {
    return transactionId != null && transactionIdShape.matcher(transactionId).matches();
  }

  public static Optional<Network> fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Network network : values()) {
      if (network.wireName.equals(normalized)) {
        return Optional.of(network);
      }
    }
    return Optional.empty();
  }

  public static Optional<Network> inferFromTransactionId(String transactionId) {
    if (transactionId == null) {
      return Optional.empty();
    }
    String candidate = transactionId.trim();
    if (BASE.matchesTransactionId(candidate)) {
      return Optional.of(BASE);
    }
    if (SOLANA.matchesTransactionId(candidate)) {
      return Optional.of(SOLANA);
    }
    return Optional.empty();
  }
}
