package com.paygate.domain.payment.gate;

public enum GateState {
  START,
  RATE_CHECKED,
  CLAIM_EXTRACTED,
  CHAIN_VERIFIED,
  REPLAY_CHECKED,
  GRANTED,
  DENIED;

  public boolean isTerminal() {
    return this == GRANTED || this == DENIED;
  }
}
