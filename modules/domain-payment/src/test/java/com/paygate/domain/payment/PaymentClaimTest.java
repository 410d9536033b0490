package com.paygate.domain.payment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PaymentClaimTest {
  @Test
  void shouldTrimTransactionId() {
    PaymentClaim claim = new PaymentClaim("  0xabc  ", Network.BASE);

    assertEquals("0xabc", claim.transactionId());
  }

  @Test
  void shouldRequireTransactionIdAndNetwork() {
    assertThrows(IllegalArgumentException.class, () -> new PaymentClaim(" ", Network.BASE));
    assertThrows(IllegalArgumentException.class, () -> new PaymentClaim("0xabc", null));
  }

  @Test
  void denialReasonsExposeStableCodes() {
    assertEquals("already_used", DenialReason.ALREADY_USED.code());
    assertEquals("rpc_unavailable", DenialReason.RPC_UNAVAILABLE.code());
  }
}
