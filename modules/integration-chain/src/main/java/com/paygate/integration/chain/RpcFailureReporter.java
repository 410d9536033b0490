package com.paygate.integration.chain;

import com.paygate.domain.payment.DenialReason;
import com.paygate.domain.payment.Network;
import com.paygate.domain.payment.PaymentClaim;
import com.paygate.domain.payment.VerificationResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class RpcFailureReporter {
  private static final Logger log = LoggerFactory.getLogger(RpcFailureReporter.class);

  static final String RPC_FAILURE_COUNTER = "chain.rpc.failures";

  private final Network network;
  private final MeterRegistry meterRegistry;

  RpcFailureReporter(Network network, MeterRegistry meterRegistry) {
    this.network = network;
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  VerificationResult failClosed(PaymentClaim claim, JsonRpcException ex) {
    meterRegistry.counter(RPC_FAILURE_COUNTER, "network", network.wireName()).increment();
    log.warn(
        "chain rpc unavailable network={} tx={} httpStatus={} rpcCode={} message={}",
        network.wireName(),
        claim.transactionId(),
        ex.httpStatus(),
        ex.rpcErrorCode(),
        ex.getMessage());
    return VerificationResult.rejected(DenialReason.RPC_UNAVAILABLE, ex.getMessage());
  }
}
