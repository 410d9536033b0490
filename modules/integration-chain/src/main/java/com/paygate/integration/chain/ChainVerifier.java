package com.paygate.integration.chain;

import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import java.math.BigDecimal;

/**
 * Confirms a claimed payment transaction on one network. Implementations fail closed: any RPC
 * problem yields a rejected result with {@code RPC_UNAVAILABLE} rather than an exception.
 */
public interface ChainVerifier {
  Network network();

  VerificationResult verify(PaymentClaim claim, String requiredRecipient, BigDecimal requiredPriceUsd);
}
