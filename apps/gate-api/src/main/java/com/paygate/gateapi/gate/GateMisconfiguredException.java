package com.paygate.gateapi.gate;

public class GateMisconfiguredException extends RuntimeException {
  public GateMisconfiguredException(String message) {
    super(message);
  }
}
