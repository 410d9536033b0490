package com.paygate.gateapi.gate;

import com.paygate.domain.payment.gate.GateDecision;
import io.micrometer.core.instrument.MeterRegistry;

public class GateMetrics {
  static final String DECISIONS_COUNTER = "gate.decisions.total";

  private final MeterRegistry meterRegistry;

  public GateMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void record(GateDecision decision) {
    meterRegistry
        .counter(
            DECISIONS_COUNTER,
            "outcome",
            decision.isGranted() ? "granted" : "denied",
            "reason",
            decision.reason() == null ? "none" : decision.reason().code())
        .increment();
  }
}
