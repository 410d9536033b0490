package com.paygate.integration.chain;

import java.net.URI;
import java.time.Duration;

public record ChainRpcConfig(URI endpoint, Duration timeout) {
  public ChainRpcConfig {
    if (endpoint == null) {
      throw new IllegalArgumentException("endpoint is required");
    }
    if (!endpoint.isAbsolute()) {
      throw new IllegalArgumentException("endpoint must be an absolute URI");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }
}
