package com.paygate.domain.payment.gate;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;

public record GateDecision(
    GateState state,
    DenialReason reason,
    PaymentClaim claim,
    VerificationResult verification,
    long retryAfterSeconds,
    String detail) {
  public GateDecision {
    if (state == null || !state.isTerminal()) {
      throw new IllegalArgumentException("decision state must be terminal: " + state);
    }
    if (state == GateState.DENIED && reason == null) {
      throw new IllegalArgumentException("denied decision requires a reason");
    }
    if (state == GateState.GRANTED && (claim == null || verification == null)) {
      throw new IllegalArgumentException("granted decision requires claim and verification");
    }
  }

  public static GateDecision granted(PaymentClaim claim, VerificationResult verification) {
    return new GateDecision(GateState.GRANTED, null, claim, verification, 0L, null);
  }

  public static GateDecision rateLimited(long retryAfterSeconds) {
    return new GateDecision(
        GateState.DENIED, DenialReason.RATE_LIMITED, null, null, retryAfterSeconds, null);
  }

  public static GateDecision paymentRequired() {
    return new GateDecision(GateState.DENIED, DenialReason.PAYMENT_REQUIRED, null, null, 0L, null);
  }

  public static GateDecision denied(DenialReason reason, String detail) {
    return new GateDecision(GateState.DENIED, reason, null, null, 0L, detail);
  }

  public static GateDecision denied(
      DenialReason reason, PaymentClaim claim, VerificationResult verification, String detail) {
    return new GateDecision(GateState.DENIED, reason, claim, verification, 0L, detail);
  }

  public boolean isGranted() {
    return state == GateState.GRANTED;
  }
}
