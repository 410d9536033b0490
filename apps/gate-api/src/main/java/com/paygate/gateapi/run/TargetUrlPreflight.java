package com.paygate.gateapi.run;

import com.paygate.domain.payment.DenialReason;
import com.paygate.gateapi.gate.PreflightRejection;
import com.paygate.gateapi.gate.RequestPreflight;
import com.paygate.integration.fetch.FetchException;
import com.paygate.integration.fetch.SsrfGuard;
import java.util.Optional;

public class TargetUrlPreflight {
  static final String MISSING_URL_MESSAGE = "Missing required parameter: ?url=<target_url>";

  private final SsrfGuard ssrfGuard;

  public TargetUrlPreflight(SsrfGuard ssrfGuard) {
    this.ssrfGuard = ssrfGuard;
  }

  public RequestPreflight forUrl(String url) {
    return () -> check(url);
  }

  Optional<PreflightRejection> check(String url) {
    if (url == null || url.isBlank()) {
      return Optional.of(new PreflightRejection(DenialReason.INVALID_REQUEST, MISSING_URL_MESSAGE));
    }
    try {
      ssrfGuard.check(url);
      return Optional.empty();
    } catch (FetchException ex) {
      DenialReason reason =
          ex.kind() == FetchException.Kind.SSRF_BLOCKED
              ? DenialReason.SSRF_BLOCKED
              : DenialReason.INVALID_REQUEST;
      return Optional.of(new PreflightRejection(reason, ex.getMessage()));
    }
  }
}
