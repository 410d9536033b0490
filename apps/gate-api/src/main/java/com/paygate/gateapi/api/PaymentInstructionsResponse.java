package com.paygate.gateapi.api;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record PaymentInstructionsResponse(
    String error,
    String service,
    BigDecimal price,
    String currency,
    String wallet,
    List<NetworkInstruction> networks,
    String endpoint,
    String description,
    PaymentHeaders headers,
    Map<String, Object> schema) {
  public record NetworkInstruction(String network, String asset, String recipient) {}

  public record PaymentHeaders(String signature, String network) {}
}
