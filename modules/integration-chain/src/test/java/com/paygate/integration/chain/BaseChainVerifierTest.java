package com.paygate.integration.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentAmountPolicy;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Duration;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BaseChainVerifierTest {
  private static final String TX_HASH = "0x" + "ab12".repeat(16);
  private static final String RECIPIENT = "0x1111111111111111111111111111111111111AbC";
  private static final String PAYER = "0x2222222222222222222222222222222222222222";
  private static final BigDecimal PRICE = new BigDecimal("0.005");

  private MockWebServer server;
  private SimpleMeterRegistry meterRegistry;
  private BaseChainVerifier verifier;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    meterRegistry = new SimpleMeterRegistry();
    HttpJsonRpcClient rpcClient =
        new HttpJsonRpcClient(
            HttpClient.newHttpClient(),
            new ObjectMapper(),
            new ChainRpcConfig(server.url("/").uri(), Duration.ofSeconds(2)));
    verifier =
        new BaseChainVerifier(
            rpcClient, BaseChainVerifier.USDC_CONTRACT, new PaymentAmountPolicy(), meterRegistry);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldAcceptUsdcTransferToRecipient() throws Exception {
    enqueueReceipt("0x1", transferLog(BaseChainVerifier.USDC_CONTRACT, PAYER, RECIPIENT, 5_000L));
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertTrue(result.isAccepted());
    assertEquals(0, new BigDecimal("0.005").compareTo(result.amountUsd()));
    assertEquals(PAYER, result.payer());
    assertEquals(RECIPIENT.toLowerCase(), result.recipient());
    assertTrue(server.takeRequest().getBody().readUtf8().contains("eth_getTransactionReceipt"));
    assertTrue(server.takeRequest().getBody().readUtf8().contains("eth_getTransactionByHash"));
  }

  @Test
  void shouldSumMultipleTransfersToRecipient() {
    enqueueReceipt(
        "0x1",
        transferLog(BaseChainVerifier.USDC_CONTRACT, PAYER, RECIPIENT, 2_500L)
            + ","
            + transferLog(BaseChainVerifier.USDC_CONTRACT, PAYER, RECIPIENT, 2_400L));
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertTrue(result.isAccepted());
    assertEquals(0, new BigDecimal("0.0049").compareTo(result.amountUsd()));
  }

  @Test
  void shouldRejectAmountBelowTolerance() {
    enqueueReceipt("0x1", transferLog(BaseChainVerifier.USDC_CONTRACT, PAYER, RECIPIENT, 4_899L));
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.AMOUNT_MISMATCH, result.reason());
  }

  @Test
  void shouldTreatMissingReceiptAsPending() {
    server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));
    server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":null}"));

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.PENDING, result.reason());
  }

  @Test
  void shouldRejectRevertedTransaction() {
    enqueueReceipt("0x0", "");
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.TX_FAILED, result.reason());
  }

  @Test
  void shouldRejectReceiptWithoutUsdcTransfer() {
    String otherToken = "0x3333333333333333333333333333333333333333";
    enqueueReceipt("0x1", transferLog(otherToken, PAYER, RECIPIENT, 5_000L));
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.NO_TOKEN_TRANSFER, result.reason());
    assertEquals(PAYER, result.payer());
  }

  @Test
  void shouldRejectTransferToAnotherWallet() {
    String other = "0x4444444444444444444444444444444444444444";
    enqueueReceipt("0x1", transferLog(BaseChainVerifier.USDC_CONTRACT, PAYER, other, 5_000L));
    enqueueTransaction();

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.RECIPIENT_MISMATCH, result.reason());
  }

  @Test
  void shouldFailClosedOnServerError() {
    server.enqueue(new MockResponse().setResponseCode(503));

    VerificationResult result = verifier.verify(claim(), RECIPIENT, PRICE);

    assertEquals(DenialReason.RPC_UNAVAILABLE, result.reason());
    assertEquals(
        1.0d, meterRegistry.get("chain.rpc.failures").tag("network", "base").counter().count());
  }

  @Test
  void shouldDecodePaddedTopicAddress() {
    assertEquals(
        "0x1111111111111111111111111111111111111abc",
        BaseChainVerifier.topicAddress(padAddress(RECIPIENT)));
    assertEquals(5000L, BaseChainVerifier.parseQuantity("0x1388").longValue());
  }

  private static PaymentClaim claim() {
    return new PaymentClaim(TX_HASH, Network.BASE);
  }

  private void enqueueReceipt(String status, String logs) {
    String body =
        """
        {"jsonrpc": "2.0", "id": 1, "result": {
          "transactionHash": "%s", "status": "%s", "logs": [%s]}}
        """
            .formatted(TX_HASH, status, logs);
    server.enqueue(new MockResponse().setResponseCode(200).setBody(body));
  }

  private void enqueueTransaction() {
    String body =
        """
        {"jsonrpc": "2.0", "id": 2, "result": {
          "hash": "%s", "from": "%s", "to": "%s"}}
        """
            .formatted(TX_HASH, PAYER, BaseChainVerifier.USDC_CONTRACT);
    server.enqueue(new MockResponse().setResponseCode(200).setBody(body));
  }

  private static String transferLog(String contract, String from, String to, long rawAmount) {
    return """
        {"address": "%s",
         "topics": ["%s", "%s", "%s"],
         "data": "0x%064x"}
        """
        .formatted(
            contract, BaseChainVerifier.TRANSFER_TOPIC, padAddress(from), padAddress(to), rawAmount);
  }

  private static String padAddress(String address) {
    return "0x" + "0".repeat(24) + address.substring(2);
  }
}
