package com.paygate.gateapi.replay;

public enum ConsumeResult {
  FIRST_USE,
  ALREADY_USED
}
