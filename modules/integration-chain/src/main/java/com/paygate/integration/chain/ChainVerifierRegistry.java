package com.paygate.integration.chain;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class ChainVerifierRegistry {
  private final Map<Network, ChainVerifier> verifiers = new EnumMap<>(Network.class);

  public ChainVerifierRegistry(Collection<? extends ChainVerifier> verifiers) {
    for (ChainVerifier verifier : verifiers) {
      ChainVerifier previous = this.verifiers.putIfAbsent(verifier.network(), verifier);
      if (previous != null) {
        throw new IllegalArgumentException(
            "Duplicate chain verifier for network " + verifier.network().wireName());
      }
    }
  }

  public Optional<ChainVerifier> verifierFor(Network network) {
    return Optional.ofNullable(verifiers.get(network));
  }

  public Set<Network> supportedNetworks() {
    return Set.copyOf(verifiers.keySet());
  }

  public VerificationResult verify(
      PaymentClaim claim, String requiredRecipient, BigDecimal requiredPriceUsd) {
    return verifierFor(claim.network())
        .map(verifier -> verifier.verify(claim, requiredRecipient, requiredPriceUsd))
        .orElseGet(
            () ->
                VerificationResult.rejected(
                    DenialReason.UNKNOWN_NETWORK,
                    "No verifier configured for network " + claim.network().wireName()));
  }
}
