package com.paygate.domain.payment;

import java.math.BigDecimal;

public record VerificationResult(
    VerificationStatus status,
    DenialReason reason,
    String payer,
    String recipient,
    BigDecimal amountUsd,
    String detail) {
  public VerificationResult {
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
    if (status == VerificationStatus.ACCEPTED && reason != null) {
      throw new IllegalArgumentException("accepted result must not carry a denial reason");
    }
    if (status == VerificationStatus.REJECTED && reason == null) {
      throw new IllegalArgumentException("rejected result requires a denial reason");
    }
  }

  public static VerificationResult accepted(String payer, String recipient, BigDecimal amountUsd) {
    return new VerificationResult(VerificationStatus.ACCEPTED, null, payer, recipient, amountUsd, null);
  }

  public static VerificationResult rejected(DenialReason reason, String detail) {
    return new VerificationResult(VerificationStatus.REJECTED, reason, null, null, null, detail);
  }

  public static VerificationResult rejected(
      DenialReason reason, String payer, String recipient, BigDecimal amountUsd, String detail) {
    return new VerificationResult(
        VerificationStatus.REJECTED, reason, payer, recipient, amountUsd, detail);
  }

  public boolean isAccepted() {
    return status == VerificationStatus.ACCEPTED;
  }
}
