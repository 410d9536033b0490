package com.paygate.domain.payment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class NetworkTest {
  private static final String SOLANA_SIGNATURE =
      "5VERv8NMvzbJMEkV8xnrLkEaWRtSz9CosKDYjCJjBRnbJLgp8uirBgmQpjKhoR4tjF3ZpRzrFmBV6UjKdiSZkQUW";
  private static final String BASE_HASH = "0x" + "ab12".repeat(16);

  @Test
  void shouldInferBaseFromPrefixedHexHash() {
    assertEquals(Optional.of(Network.BASE), Network.inferFromTransactionId(BASE_HASH));
    assertEquals(
        Optional.of(Network.BASE), Network.inferFromTransactionId(BASE_HASH.toUpperCase().replace("0X", "0x")));
  }

  @Test
  void shouldInferSolanaFromBase58Signature() {
    assertEquals(Optional.of(Network.SOLANA), Network.inferFromTransactionId(SOLANA_SIGNATURE));
    assertEquals(Optional.of(Network.SOLANA), Network.inferFromTransactionId("3".repeat(87)));
  }

  @Test
  void shouldNotInferFromUnrecognizedShapes() {
    assertTrue(Network.inferFromTransactionId("0x1234").isEmpty());
    assertTrue(Network.inferFromTransactionId("0".repeat(88)).isEmpty());
    assertTrue(Network.inferFromTransactionId("3".repeat(40)).isEmpty());
    assertTrue(Network.inferFromTransactionId("").isEmpty());
    assertTrue(Network.inferFromTransactionId(null).isEmpty());
  }

  @Test
  void shouldResolveWireNamesCaseInsensitively() {
    assertEquals(Optional.of(Network.SOLANA), Network.fromWireName("Solana"));
    assertEquals(Optional.of(Network.BASE), Network.fromWireName(" base "));
    assertTrue(Network.fromWireName("ethereum").isEmpty());
    assertTrue(Network.fromWireName(null).isEmpty());
  }
}
