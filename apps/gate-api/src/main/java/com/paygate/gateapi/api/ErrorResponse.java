package com.paygate.gateapi.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String hint) {
  public static ErrorResponse of(String error) {
    return new ErrorResponse(error, null, null);
  }
}
