package com.paygate.integration.chain;

public class JsonRpcException extends RuntimeException {
  public static final int IO_FAILURE_STATUS = -1;

  private final int httpStatus;
  private final Integer rpcErrorCode;

  public JsonRpcException(String message, int httpStatus, Integer rpcErrorCode, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.rpcErrorCode = rpcErrorCode;
  }

  public JsonRpcException(String message, int httpStatus, Integer rpcErrorCode) {
    super(message);
    this.httpStatus = httpStatus;
    this.rpcErrorCode = rpcErrorCode;
  }

  public static JsonRpcException malformed(String message) {
    return new JsonRpcException(message, IO_FAILURE_STATUS, null);
  }

  public int httpStatus() {
    return httpStatus;
  }

  public Integer rpcErrorCode() {
    return rpcErrorCode;
  }

  public boolean isRateLimited() {
    return httpStatus == 429;
  }
}
