package com.paygate.gateapi.api;

import java.math.BigDecimal;

public record RunResponse(
    String url, int status, String text, long contentLength, ProxyInfo proxy, PaymentInfo payment) {
  public record ProxyInfo(String country, String type) {}

  public record PaymentInfo(String txHash, String network, BigDecimal amount, boolean settled) {}
}
