package com.paygate.gateapi.gate;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.PaymentClaimException;
import com.paygate.domain.payment.VerificationResult;
import com.paygate.domain.payment.gate.GateDecision;
import com.paygate.domain.payment.gate.GateState;
import com.paygate.domain.payment.gate.GateStateMachine;
import com.paygate.gateapi.ratelimit.FixedWindowRateLimiter;
import com.paygate.gateapi.ratelimit.RateLimitDecision;
import com.paygate.gateapi.replay.ConsumeResult;
import com.paygate.gateapi.replay.ReplayGuard;
import com.paygate.integration.chain.ChainVerifierRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

public class PaymentGateOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(PaymentGateOrchestrator.class);

  private final FixedWindowRateLimiter rateLimiter;
  private final PaymentClaimExtractor claimExtractor;
  private final ChainVerifierRegistry verifierRegistry;
  private final ReplayGuard replayGuard;
  private final GateProperties properties;
  private final GateMetrics metrics;

  public PaymentGateOrchestrator(
      FixedWindowRateLimiter rateLimiter,
      PaymentClaimExtractor claimExtractor,
      ChainVerifierRegistry verifierRegistry,
      ReplayGuard replayGuard,
      GateProperties properties,
      GateMetrics metrics) {
    this.rateLimiter = rateLimiter;
    this.claimExtractor = claimExtractor;
    this.verifierRegistry = verifierRegistry;
    this.replayGuard = replayGuard;
    this.properties = properties;
    this.metrics = metrics;
  }

  public GateDecision evaluate(String clientId, HttpHeaders headers) {
    return evaluate(clientId, headers, RequestPreflight.NONE);
  }

  public GateDecision evaluate(String clientId, HttpHeaders headers, RequestPreflight preflight) {
    GateDecision decision = decide(clientId, headers, preflight);
    metrics.record(decision);
    PaymentClaim claim = decision.claim();
    log.info(
        "gate decision client={} outcome={} reason={} network={} tx={}",
        clientId,
        decision.state(),
        decision.reason() == null ? "none" : decision.reason().code(),
        claim == null ? "none" : claim.network().wireName(),
        claim == null ? "none" : claim.transactionId());
    return decision;
  }

  private GateDecision decide(String clientId, HttpHeaders headers, RequestPreflight preflight) {
    GateState state = GateState.START;

    RateLimitDecision rate = rateLimiter.admit(clientId);
    if (!rate.allowed()) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.rateLimited(rate.retryAfterSeconds());
    }
    state = GateStateMachine.transition(state, GateState.RATE_CHECKED);

    Optional<PreflightRejection> rejection = preflight.check();
    if (rejection.isPresent()) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.denied(rejection.get().reason(), rejection.get().detail());
    }

    Optional<PaymentClaim> extracted;
    try {
      extracted = claimExtractor.extract(headers);
    } catch (PaymentClaimException ex) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.denied(ex.reason(), ex.getMessage());
    }
    if (extracted.isEmpty()) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.paymentRequired();
    }
    PaymentClaim claim = extracted.get();
    state = GateStateMachine.transition(state, GateState.CLAIM_EXTRACTED);

    String recipient = properties.recipientFor(claim.network());
    VerificationResult verification = verify(claim, recipient);
    if (!verification.isAccepted()) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.denied(
          verification.reason(), claim, verification, verification.detail());
    }
    state = GateStateMachine.transition(state, GateState.CHAIN_VERIFIED);

    ConsumeResult consumed = replayGuard.consume(claim.network(), claim.transactionId());
    state = GateStateMachine.transition(state, GateState.REPLAY_CHECKED);
    if (consumed == ConsumeResult.ALREADY_USED) {
      GateStateMachine.transition(state, GateState.DENIED);
      return GateDecision.denied(
          DenialReason.ALREADY_USED, claim, verification, "Transaction was already used");
    }
    GateStateMachine.transition(state, GateState.GRANTED);
    return GateDecision.granted(claim, verification);
  }

  private VerificationResult verify(PaymentClaim claim, String recipient) {
    try {
      return verifierRegistry.verify(claim, recipient, properties.getPriceUsd());
    } catch (RuntimeException ex) {
      log.error(
          "chain verification failed unexpectedly network={} tx={}",
          claim.network().wireName(),
          claim.transactionId(),
          ex);
      return VerificationResult.rejected(
          DenialReason.RPC_UNAVAILABLE, "Payment verification is temporarily unavailable");
    }
  }
}
