package com.paygate.domain.payment;

public enum VerificationStatus {
  ACCEPTED,
  REJECTED
}
