package com.paygate.gateapi.gate;

import com.paygate.domain.payment.DenialReason;

public record PreflightRejection(DenialReason reason, String detail) {
  public PreflightRejection {
    if (reason != DenialReason.INVALID_REQUEST && reason != DenialReason.SSRF_BLOCKED) {
      throw new IllegalArgumentException("preflight may only reject invalid or blocked input");
    }
  }
}
