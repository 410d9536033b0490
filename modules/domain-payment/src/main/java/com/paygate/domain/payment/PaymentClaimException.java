package com.paygate.domain.payment;

public class PaymentClaimException extends RuntimeException {
  private final DenialReason reason;

  public PaymentClaimException(DenialReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DenialReason reason() {
    return reason;
  }
}
