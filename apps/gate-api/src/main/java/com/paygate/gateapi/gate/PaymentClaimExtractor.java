package com.paygate.gateapi.gate;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.PaymentClaimException;
import java.util.Optional;
import org.springframework.http.HttpHeaders;

public class PaymentClaimExtractor {
  private final String signatureHeader;
  private final String networkHeader;

  public PaymentClaimExtractor(String signatureHeader, String networkHeader) {
    if (signatureHeader == null || signatureHeader.isBlank()) {
      throw new IllegalArgumentException("signatureHeader is required");
    }
    if (networkHeader == null || networkHeader.isBlank()) {
      throw new IllegalArgumentException("networkHeader is required");
    }
    this.signatureHeader = signatureHeader;
    this.networkHeader = networkHeader;
  }

  /**
   * Reads the payment headers. Empty when no transaction id was offered; an explicit network that
   * disagrees with the id shape is passed through for the verifier to reject.
   */
  public Optional<PaymentClaim> extract(HttpHeaders headers) {
    String transactionId = trimToNull(headers.getFirst(signatureHeader));
    if (transactionId == null) {
      return Optional.empty();
    }

    String networkName = trimToNull(headers.getFirst(networkHeader));
    Network network;
    if (networkName != null) {
      network =
          Network.fromWireName(networkName)
              .orElseThrow(
                  () ->
                      new PaymentClaimException(
                          DenialReason.UNKNOWN_NETWORK, "Unsupported network: " + networkName));
    } else {
      network =
          Network.inferFromTransactionId(transactionId)
              .orElseThrow(
                  () ->
                      new PaymentClaimException(
                          DenialReason.UNKNOWN_NETWORK,
                          "Cannot infer network from transaction id; send " + networkHeader));
    }
    return Optional.of(new PaymentClaim(transactionId, network));
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
