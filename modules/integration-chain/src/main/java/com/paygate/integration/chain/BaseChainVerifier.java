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
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public class BaseChainVerifier implements ChainVerifier {
  public static final String USDC_CONTRACT = "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913";
  static final String TRANSFER_TOPIC =
      "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";
  private static final int USDC_DECIMALS = 6;

  private final HttpJsonRpcClient rpcClient;
  private final String usdcContract;
  private final PaymentAmountPolicy amountPolicy;
  private final RpcFailureReporter failures;

  public BaseChainVerifier(
      HttpJsonRpcClient rpcClient,
      String usdcContract,
      PaymentAmountPolicy amountPolicy,
      MeterRegistry meterRegistry) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    if (usdcContract == null || usdcContract.isBlank()) {
      throw new IllegalArgumentException("usdcContract is required");
    }
    this.usdcContract = usdcContract.trim().toLowerCase(Locale.ROOT);
    this.amountPolicy = Objects.requireNonNull(amountPolicy, "amountPolicy must not be null");
    this.failures = new RpcFailureReporter(Network.BASE, meterRegistry);
  }

  @Override
  public Network network() {
    return Network.BASE;
  }

  @Override
  public VerificationResult verify(
      PaymentClaim claim, String requiredRecipient, BigDecimal requiredPriceUsd) {
    JsonNode receipt;
    JsonNode transaction;
    try {
      receipt = rpcClient.call("eth_getTransactionReceipt", List.of(claim.transactionId()));
      transaction = rpcClient.call("eth_getTransactionByHash", List.of(claim.transactionId()));
    } catch (JsonRpcException ex) {
      return failures.failClosed(claim, ex);
    }

    if (receipt == null || receipt.isNull() || transaction == null || transaction.isNull()) {
      return VerificationResult.rejected(
          DenialReason.PENDING, "Transaction not found or not yet mined");
    }
    String status = receipt.path("status").asText("");
    if (!"0x1".equalsIgnoreCase(status)) {
      return VerificationResult.rejected(
          DenialReason.TX_FAILED, "Transaction reverted with status " + status);
    }

    String recipient = requiredRecipient.trim().toLowerCase(Locale.ROOT);
    boolean sawTransfer = false;
    boolean sawRecipient = false;
    BigInteger received = BigInteger.ZERO;
    String payer = null;
    try {
      for (JsonNode entry : receipt.path("logs")) {
        if (!usdcContract.equalsIgnoreCase(entry.path("address").asText(""))) {
          continue;
        }
        JsonNode topics = entry.path("topics");
        if (topics.size() < 3 || !TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0).asText(""))) {
          continue;
        }
        sawTransfer = true;
        String to = topicAddress(topics.get(2).asText(""));
        if (!recipient.equals(to)) {
          continue;
        }
        sawRecipient = true;
        received = received.add(parseQuantity(entry.path("data").asText("0x0")));
        if (payer == null) {
          payer = topicAddress(topics.get(1).asText(""));
        }
      }
    } catch (NumberFormatException ex) {
      return failures.failClosed(
          claim, JsonRpcException.malformed("Transfer log carries a non-numeric value"));
    }

    if (payer == null) {
      payer = transaction.path("from").asText(null);
    }
    if (!sawTransfer) {
      return VerificationResult.rejected(
          DenialReason.NO_TOKEN_TRANSFER, payer, null, null, "No USDC Transfer event in receipt");
    }
    if (!sawRecipient) {
      return VerificationResult.rejected(
          DenialReason.RECIPIENT_MISMATCH,
          payer,
          null,
          null,
          "No USDC Transfer to the service wallet");
    }

    BigDecimal amountUsd = PaymentAmountPolicy.toUsd(received, USDC_DECIMALS);
    if (!amountPolicy.isSufficient(amountUsd, requiredPriceUsd)) {
      return VerificationResult.rejected(
          DenialReason.AMOUNT_MISMATCH,
          payer,
          recipient,
          amountUsd,
          "Received "
              + amountUsd.toPlainString()
              + " USDC, expected at least "
              + amountPolicy.minimumAcceptedUsd(requiredPriceUsd).toPlainString());
    }
    return VerificationResult.accepted(payer, recipient, amountUsd);
  }

  // Indexed address topics are left-padded to 32 bytes.
  static String topicAddress(String topic) {
    String hex = topic.startsWith("0x") || topic.startsWith("0X") ? topic.substring(2) : topic;
    if (hex.length() < 40) {
      return "";
    }
    return "0x" + hex.substring(hex.length() - 40).toLowerCase(Locale.ROOT);
  }

  static BigInteger parseQuantity(String hex) {
    String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    if (digits.isEmpty()) {
      return BigInteger.ZERO;
    }
    return new BigInteger(digits, 16);
  }
}
