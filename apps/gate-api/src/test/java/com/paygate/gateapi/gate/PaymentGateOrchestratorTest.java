package com.paygate.gateapi.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import com.paygate.domain.payment.gate.GateDecision;
import com.paygate.domain.payment.gate.GateState;
import com.paygate.gateapi.ratelimit.FixedWindowRateLimiter;
import com.paygate.gateapi.ratelimit.InMemoryRateWindowStore;
import com.paygate.gateapi.ratelimit.RateLimitProperties;
import com.paygate.gateapi.replay.InMemoryReplayStore;
import com.paygate.gateapi.replay.ReplayGuard;
import com.paygate.integration.chain.ChainVerifier;
import com.paygate.integration.chain.ChainVerifierRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpHeaders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class PaymentGateOrchestratorTest {
  private static final Clock FIXED_CLOCK =
      Clock.fixed(Instant.parse("2026-02-25T00:00:00Z"), ZoneOffset.UTC);
  private static final String WALLET = "0x1111111111111111111111111111111111111111";
  private static final String BASE_HASH = "0x" + "ab12".repeat(16);
  private static final BigDecimal PRICE = new BigDecimal("0.005");

  @Mock private ChainVerifier baseVerifier;

  private SimpleMeterRegistry meterRegistry;
  private RateLimitProperties rateLimitProperties;
  private GateProperties gateProperties;
  private PaymentGateOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    when(baseVerifier.network()).thenReturn(Network.BASE);
    meterRegistry = new SimpleMeterRegistry();
    rateLimitProperties = new RateLimitProperties();
    gateProperties = new GateProperties();
    gateProperties.setWalletAddress(WALLET);
    orchestrator = newOrchestrator();
  }

  private PaymentGateOrchestrator newOrchestrator() {
    return new PaymentGateOrchestrator(
        new FixedWindowRateLimiter(new InMemoryRateWindowStore(), rateLimitProperties, FIXED_CLOCK),
        new PaymentClaimExtractor(
            gateProperties.getSignatureHeader(), gateProperties.getNetworkHeader()),
        new ChainVerifierRegistry(List.of(baseVerifier)),
        new ReplayGuard(new InMemoryReplayStore(), FIXED_CLOCK),
        gateProperties,
        new GateMetrics(meterRegistry));
  }

  @Test
  void shouldGrantFirstUseOfAcceptedPayment() {
    when(baseVerifier.verify(any(), eq(WALLET), eq(PRICE)))
        .thenReturn(VerificationResult.accepted("0xpayer", WALLET, new BigDecimal("0.005")));

    GateDecision decision = orchestrator.evaluate("client", paid(BASE_HASH));

    assertTrue(decision.isGranted());
    assertEquals(GateState.GRANTED, decision.state());
    assertEquals(new PaymentClaim(BASE_HASH, Network.BASE), decision.claim());
    assertEquals(
        1.0d,
        meterRegistry
            .get("gate.decisions.total")
            .tag("outcome", "granted")
            .tag("reason", "none")
            .counter()
            .count());
  }

  @Test
  void shouldDenyReplayedTransaction() {
    when(baseVerifier.verify(any(), eq(WALLET), eq(PRICE)))
        .thenReturn(VerificationResult.accepted("0xpayer", WALLET, new BigDecimal("0.005")));

    assertTrue(orchestrator.evaluate("client", paid(BASE_HASH)).isGranted());
    GateDecision second = orchestrator.evaluate("client", paid(BASE_HASH));

    assertFalse(second.isGranted());
    assertEquals(DenialReason.ALREADY_USED, second.reason());
  }

  @Test
  void shouldDenyAmountMismatchWithoutConsumingProof() {
    when(baseVerifier.verify(any(), eq(WALLET), eq(PRICE)))
        .thenReturn(
            VerificationResult.rejected(
                DenialReason.AMOUNT_MISMATCH,
                "0xpayer",
                WALLET,
                new BigDecimal("0.0048"),
                "Received 0.0048 USDC"))
        .thenReturn(VerificationResult.accepted("0xpayer", WALLET, new BigDecimal("0.005")));

    GateDecision first = orchestrator.evaluate("client", paid(BASE_HASH));
    GateDecision second = orchestrator.evaluate("client", paid(BASE_HASH));

    assertEquals(DenialReason.AMOUNT_MISMATCH, first.reason());
    assertEquals("Received 0.0048 USDC", first.detail());
    assertTrue(second.isGranted());
  }

  @Test
  void shouldRequirePaymentWhenNoClaimOffered() {
    GateDecision decision = orchestrator.evaluate("client", new HttpHeaders());

    assertEquals(DenialReason.PAYMENT_REQUIRED, decision.reason());
    verify(baseVerifier, never()).verify(any(), any(), any());
  }

  @Test
  void shouldDenyUnknownNetwork() {
    HttpHeaders headers = paid(BASE_HASH);
    headers.add("X-Payment-Network", "dogecoin");

    GateDecision decision = orchestrator.evaluate("client", headers);

    assertEquals(DenialReason.UNKNOWN_NETWORK, decision.reason());
  }

  @Test
  void shouldRateLimitBeforeAnyOtherWork() {
    rateLimitProperties.setMaxRequests(1);
    orchestrator = newOrchestrator();
    orchestrator.evaluate("client", new HttpHeaders());

    GateDecision decision = orchestrator.evaluate("client", paid(BASE_HASH));

    assertEquals(DenialReason.RATE_LIMITED, decision.reason());
    assertEquals(60, decision.retryAfterSeconds());
    verify(baseVerifier, never()).verify(any(), any(), any());
  }

  @Test
  void shouldRejectPreflightFailureBeforeVerification() {
    GateDecision decision =
        orchestrator.evaluate(
            "client",
            paid(BASE_HASH),
            () ->
                Optional.of(
                    new PreflightRejection(
                        DenialReason.SSRF_BLOCKED, "Private/internal URLs are not allowed")));

    assertEquals(DenialReason.SSRF_BLOCKED, decision.reason());
    verify(baseVerifier, never()).verify(any(), any(), any());

    when(baseVerifier.verify(any(), eq(WALLET), eq(PRICE)))
        .thenReturn(VerificationResult.accepted("0xpayer", WALLET, new BigDecimal("0.005")));
    assertTrue(orchestrator.evaluate("client", paid(BASE_HASH)).isGranted());
  }

  @Test
  void shouldFailClosedWhenVerifierThrows() {
    when(baseVerifier.verify(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

    GateDecision decision = orchestrator.evaluate("client", paid(BASE_HASH));

    assertEquals(DenialReason.RPC_UNAVAILABLE, decision.reason());
    assertFalse(decision.isGranted());
  }

  @Test
  void shouldDenyNetworkWithoutVerifier() {
    HttpHeaders headers =
        paid("5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW");

    GateDecision decision = orchestrator.evaluate("client", headers);

    assertEquals(DenialReason.UNKNOWN_NETWORK, decision.reason());
  }

  @Test
  void shouldUseSolanaWalletOverride() {
    gateProperties.setSolanaWalletAddress("SolWallet111");

    assertEquals("SolWallet111", gateProperties.recipientFor(Network.SOLANA));
    assertEquals(WALLET, gateProperties.recipientFor(Network.BASE));
  }

  @Test
  void shouldFailWhenWalletMissing() {
    gateProperties.setWalletAddress("");

    assertThrows(
        GateMisconfiguredException.class, () -> orchestrator.evaluate("client", paid(BASE_HASH)));
    verify(baseVerifier, times(0)).verify(any(), any(), any());
  }

  private static HttpHeaders paid(String transactionId) {
    HttpHeaders headers = new HttpHeaders();
    headers.add("X-Payment-Signature", transactionId);
    return headers;
  }
}
