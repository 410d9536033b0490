package com.paygate.gateapi.gate;

import java.util.Optional;

/** Input validation run after the rate check and before any payment proof is examined. */
@FunctionalInterface
public interface RequestPreflight {
  RequestPreflight NONE = Optional::empty;

  Optional<PreflightRejection> check();
}
