package com.paygate.domain.payment;

import java.math.BigDecimal;
import java.math.BigInteger;

public final class PaymentAmountPolicy {
  public static final BigDecimal DEFAULT_TOLERANCE_FACTOR = new BigDecimal("0.98");

  private final BigDecimal toleranceFactor;

  public PaymentAmountPolicy() {
    this(DEFAULT_TOLERANCE_FACTOR);
  }

  public PaymentAmountPolicy(BigDecimal toleranceFactor) {
    if (toleranceFactor == null
        || toleranceFactor.signum() <= 0
        || toleranceFactor.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("toleranceFactor must be in (0, 1]");
    }
    this.toleranceFactor = toleranceFactor;
  }

  public BigDecimal minimumAcceptedUsd(BigDecimal requiredPriceUsd) {
    if (requiredPriceUsd == null || requiredPriceUsd.signum() < 0) {
      throw new IllegalArgumentException("requiredPriceUsd must be >= 0");
    }
    return requiredPriceUsd.multiply(toleranceFactor);
  }

  public boolean isSufficient(BigDecimal amountUsd, BigDecimal requiredPriceUsd) {
    if (amountUsd == null) {
      return false;
    }
    return amountUsd.compareTo(minimumAcceptedUsd(requiredPriceUsd)) >= 0;
  }

  public static BigDecimal toUsd(BigInteger rawAmount, int decimals) {
    if (rawAmount == null) {
      return BigDecimal.ZERO;
    }
    return new BigDecimal(rawAmount, decimals);
  }
}
