package com.paygate.gateapi.api;

import com.paygate.domain.payment.Network;
import com.paygate.gateapi.gate.GateProperties;
import com.paygate.integration.chain.ChainVerifierRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PaymentInstructionsFactory {
  static final String ASSET = "USDC";

  private final GateProperties properties;
  private final ChainVerifierRegistry verifierRegistry;

  public PaymentInstructionsFactory(
      GateProperties properties, ChainVerifierRegistry verifierRegistry) {
    this.properties = properties;
    this.verifierRegistry = verifierRegistry;
  }

  public PaymentInstructionsResponse paymentRequired() {
    List<PaymentInstructionsResponse.NetworkInstruction> networks = new ArrayList<>();
    for (Network network : Network.values()) {
      if (verifierRegistry.verifierFor(network).isPresent()) {
        networks.add(
            new PaymentInstructionsResponse.NetworkInstruction(
                network.wireName(), ASSET, properties.recipientFor(network)));
      }
    }
    return new PaymentInstructionsResponse(
        "Payment required",
        properties.getServiceName(),
        properties.getPriceUsd(),
        ASSET,
        properties.requireWalletAddress(),
        List.copyOf(networks),
        properties.getEndpoint(),
        properties.getDescription(),
        new PaymentInstructionsResponse.PaymentHeaders(
            properties.getSignatureHeader(), properties.getNetworkHeader()),
        outputSchema());
  }

  private Map<String, Object> outputSchema() {
    Map<String, Object> output = new LinkedHashMap<>();
    output.put("url", "string, the URL that was fetched");
    output.put("status", "number, HTTP status code from the target");
    output.put("text", "string, page text content (max " + properties.getMaxTextLength() + " chars)");
    output.put("contentLength", "number, original content length");
    output.put("proxy", "{ country: string, type: \"mobile\" }");

    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("input", Map.of("url", "string, URL to fetch (required)"));
    schema.put("output", output);
    return schema;
  }
}
