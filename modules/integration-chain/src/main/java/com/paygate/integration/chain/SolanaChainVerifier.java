package com.paygate.integration.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentAmountPolicy;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class SolanaChainVerifier implements ChainVerifier {
  public static final String USDC_MINT = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

  private final HttpJsonRpcClient rpcClient;
  private final String usdcMint;
  private final PaymentAmountPolicy amountPolicy;
  private final RpcFailureReporter failures;

  public SolanaChainVerifier(
      HttpJsonRpcClient rpcClient,
      String usdcMint,
      PaymentAmountPolicy amountPolicy,
      MeterRegistry meterRegistry) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    if (usdcMint == null || usdcMint.isBlank()) {
      throw new IllegalArgumentException("usdcMint is required");
    }
    this.usdcMint = usdcMint.trim();
    this.amountPolicy = Objects.requireNonNull(amountPolicy, "amountPolicy must not be null");
    this.failures = new RpcFailureReporter(Network.SOLANA, meterRegistry);
  }

  @Override
  public Network network() {
    return Network.SOLANA;
  }

  @Override
  public VerificationResult verify(
      PaymentClaim claim, String requiredRecipient, BigDecimal requiredPriceUsd) {
    JsonNode transaction;
    try {
      transaction =
          rpcClient.call(
              "getTransaction",
              List.of(
                  claim.transactionId(),
                  Map.of(
                      "encoding", "jsonParsed",
                      "commitment", "confirmed",
                      "maxSupportedTransactionVersion", 0)));
    } catch (JsonRpcException ex) {
      return failures.failClosed(claim, ex);
    }

    if (transaction == null || transaction.isNull()) {
      return VerificationResult.rejected(
          DenialReason.PENDING, "Transaction not found or not yet confirmed");
    }
    JsonNode meta = transaction.get("meta");
    if (meta == null || !meta.isObject()) {
      return failures.failClosed(
          claim, JsonRpcException.malformed("getTransaction result missing field: meta"));
    }
    if (meta.hasNonNull("err")) {
      return VerificationResult.rejected(
          DenialReason.TX_FAILED, "Transaction failed: " + meta.get("err"));
    }

    Map<String, BigInteger> deltas = new LinkedHashMap<>();
    int decimals;
    try {
      int preDecimals = accumulate(meta.path("preTokenBalances"), deltas, BigInteger.ONE.negate());
      int postDecimals = accumulate(meta.path("postTokenBalances"), deltas, BigInteger.ONE);
      decimals = Math.max(preDecimals, postDecimals);
    } catch (NumberFormatException ex) {
      return failures.failClosed(
          claim, JsonRpcException.malformed("getTransaction token balance is not numeric"));
    }

    if (deltas.isEmpty()) {
      return VerificationResult.rejected(
          DenialReason.NO_TOKEN_TRANSFER, "Transaction has no USDC token balance changes");
    }
    String payer = findPayer(transaction, deltas);
    if (!deltas.containsKey(requiredRecipient)) {
      return VerificationResult.rejected(
          DenialReason.RECIPIENT_MISMATCH,
          payer,
          null,
          null,
          "No USDC balance entry for the service wallet");
    }

    BigDecimal amountUsd =
        PaymentAmountPolicy.toUsd(deltas.get(requiredRecipient), Math.max(decimals, 0));
    if (!amountPolicy.isSufficient(amountUsd, requiredPriceUsd)) {
      return VerificationResult.rejected(
          DenialReason.AMOUNT_MISMATCH,
          payer,
          requiredRecipient,
          amountUsd,
          "Received "
              + amountUsd.toPlainString()
              + " USDC, expected at least "
              + amountPolicy.minimumAcceptedUsd(requiredPriceUsd).toPlainString());
    }
    return VerificationResult.accepted(payer, requiredRecipient, amountUsd);
  }

  // Adds sign * amount per owner for entries of the configured mint; returns the decimals seen.
  private int accumulate(JsonNode balances, Map<String, BigInteger> deltas, BigInteger sign) {
    int decimals = -1;
    if (!balances.isArray()) {
      return decimals;
    }
    for (JsonNode balance : balances) {
      if (!usdcMint.equals(balance.path("mint").asText(""))) {
        continue;
      }
      String owner = balance.path("owner").asText("");
      if (owner.isBlank()) {
        continue;
      }
      JsonNode tokenAmount = balance.path("uiTokenAmount");
      BigInteger raw = new BigInteger(tokenAmount.path("amount").asText("0"));
      decimals = Math.max(decimals, tokenAmount.path("decimals").asInt(6));
      deltas.merge(owner, raw.multiply(sign), BigInteger::add);
    }
    return decimals;
  }

  private static String findPayer(JsonNode transaction, Map<String, BigInteger> deltas) {
    String payer = null;
    BigInteger largestDecrease = BigInteger.ZERO;
    for (Map.Entry<String, BigInteger> entry : deltas.entrySet()) {
      if (entry.getValue().compareTo(largestDecrease) < 0) {
        largestDecrease = entry.getValue();
        payer = entry.getKey();
      }
    }
    if (payer != null) {
      return payer;
    }
    JsonNode accountKeys = transaction.path("transaction").path("message").path("accountKeys");
    if (accountKeys.isArray() && accountKeys.size() > 0) {
      JsonNode feePayer = accountKeys.get(0);
      return feePayer.isObject() ? feePayer.path("pubkey").asText(null) : feePayer.asText(null);
    }
    return null;
  }
}
