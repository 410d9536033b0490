package com.paygate.gateapi.api;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.gate.GateDecision;
import com.paygate.gateapi.gate.GateProperties;
import com.paygate.gateapi.gate.PaymentGateOrchestrator;
import com.paygate.gateapi.ratelimit.ClientIdentityResolver;
import com.paygate.gateapi.run.TargetUrlPreflight;
import com.paygate.gateapi.run.WebFetchResult;
import com.paygate.gateapi.run.WebFetchService;
import com.paygate.integration.fetch.FetchException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class RunController {
  private static final Logger log = LoggerFactory.getLogger(RunController.class);

  static final String SETTLED_HEADER = "X-Payment-Settled";
  static final String TX_HASH_HEADER = "X-Payment-TxHash";
  private static final String VERIFICATION_FAILED = "Payment verification failed";
  private static final String EXECUTION_FAILED = "Service execution failed";
  private static final String EXECUTION_HINT =
      "The target URL may be unreachable or the proxy may be temporarily unavailable.";

  private final PaymentGateOrchestrator orchestrator;
  private final ClientIdentityResolver identityResolver;
  private final TargetUrlPreflight targetUrlPreflight;
  private final WebFetchService webFetchService;
  private final PaymentInstructionsFactory instructionsFactory;
  private final GateProperties gateProperties;

  public RunController(
      PaymentGateOrchestrator orchestrator,
      ClientIdentityResolver identityResolver,
      TargetUrlPreflight targetUrlPreflight,
      WebFetchService webFetchService,
      PaymentInstructionsFactory instructionsFactory,
      GateProperties gateProperties) {
    this.orchestrator = orchestrator;
    this.identityResolver = identityResolver;
    this.targetUrlPreflight = targetUrlPreflight;
    this.webFetchService = webFetchService;
    this.instructionsFactory = instructionsFactory;
    this.gateProperties = gateProperties;
  }

  @GetMapping("/run")
  public ResponseEntity<?> run(
      @RequestParam(name = "url", required = false) String url,
      @RequestHeader HttpHeaders headers,
      HttpServletRequest request) {
    gateProperties.requireWalletAddress();

    GateDecision decision =
        orchestrator.evaluate(
            identityResolver.resolve(request), headers, targetUrlPreflight.forUrl(url));
    if (!decision.isGranted()) {
      return denied(decision);
    }

    WebFetchResult result;
    try {
      result = webFetchService.fetch(url);
    } catch (FetchException ex) {
      log.warn(
          "paid fetch failed tx={} kind={} attempts={} message={}",
          decision.claim().transactionId(),
          ex.kind(),
          ex.attempts(),
          ex.getMessage());
      return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
          .body(new ErrorResponse(EXECUTION_FAILED, ex.getMessage(), EXECUTION_HINT));
    }

    RunResponse body =
        new RunResponse(
            result.url(),
            result.status(),
            result.text(),
            result.contentLength(),
            new RunResponse.ProxyInfo(result.proxyCountry(), "mobile"),
            new RunResponse.PaymentInfo(
                decision.claim().transactionId(),
                decision.claim().network().wireName(),
                decision.verification().amountUsd(),
                true));
    return ResponseEntity.ok()
        .header(SETTLED_HEADER, "true")
        .header(TX_HASH_HEADER, decision.claim().transactionId())
        .body(body);
  }

  private ResponseEntity<?> denied(GateDecision decision) {
    DenialReason reason = decision.reason();
    switch (reason) {
      case RATE_LIMITED:
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()))
            .body(
                new RateLimitedResponse(
                    "Too many requests", reason.code(), decision.retryAfterSeconds()));
      case PAYMENT_REQUIRED:
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
            .body(instructionsFactory.paymentRequired());
      case INVALID_REQUEST:
      case SSRF_BLOCKED:
        return ResponseEntity.badRequest().body(ErrorResponse.of(decision.detail()));
      default:
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
            .body(new VerificationFailureResponse(VERIFICATION_FAILED, reason.code(), reason.hint()));
    }
  }
}
