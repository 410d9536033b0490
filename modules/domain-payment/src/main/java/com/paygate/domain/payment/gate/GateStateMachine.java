package com.paygate.domain.payment.gate;

import java.util.EnumSet;
import java.util.Map;

public final class GateStateMachine {
  private static final Map<GateState, EnumSet<GateState>> ALLOWED_TRANSITIONS =
      Map.of(
          GateState.START, EnumSet.of(GateState.RATE_CHECKED, GateState.DENIED),
          GateState.RATE_CHECKED, EnumSet.of(GateState.CLAIM_EXTRACTED, GateState.DENIED),
          GateState.CLAIM_EXTRACTED, EnumSet.of(GateState.CHAIN_VERIFIED, GateState.DENIED),
          GateState.CHAIN_VERIFIED, EnumSet.of(GateState.REPLAY_CHECKED),
          GateState.REPLAY_CHECKED, EnumSet.of(GateState.GRANTED, GateState.DENIED),
          GateState.GRANTED, EnumSet.noneOf(GateState.class),
          GateState.DENIED, EnumSet.noneOf(GateState.class));

  private GateStateMachine() {}

  public static boolean canTransition(GateState from, GateState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<GateState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static GateState transition(GateState from, GateState to) {
    if (!canTransition(from, to)) {
      throw new IllegalStateException("Invalid gate transition from " + from + " to " + to);
    }
    return to;
  }
}
