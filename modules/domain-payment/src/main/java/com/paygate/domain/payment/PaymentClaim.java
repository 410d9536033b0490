package com.paygate.domain.payment;

public record PaymentClaim(String transactionId, Network network) {
  public PaymentClaim {
    if (transactionId == null || transactionId.isBlank()) {
      throw new IllegalArgumentException("transactionId is required");
    }
    if (network == null) {
      throw new IllegalArgumentException("network is required");
    }
    transactionId = transactionId.trim();
  }
}
