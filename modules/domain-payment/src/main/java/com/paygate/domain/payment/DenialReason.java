package com.paygate.domain.payment;

public enum DenialReason {
  PAYMENT_REQUIRED("payment_required", "Send a payment transaction and retry with its id in the payment header."),
  UNKNOWN_NETWORK("unknown_network", "Supported networks are solana and base."),
  TX_NOT_FOUND("tx_not_found", "The transaction could not be found on the selected network."),
  PENDING("pending", "The transaction is not confirmed yet. Wait a few seconds and retry with the same id."),
  TX_FAILED("tx_failed", "The transaction failed on-chain and did not transfer funds."),
  NO_TOKEN_TRANSFER("no_token_transfer", "The transaction contains no USDC transfer."),
  AMOUNT_MISMATCH("amount_mismatch", "The transferred USDC amount is below the price of this endpoint."),
  RECIPIENT_MISMATCH("recipient_mismatch", "The USDC transfer was not sent to the service wallet."),
  ALREADY_USED("already_used", "This transaction was already used to pay for a request."),
  RPC_UNAVAILABLE("rpc_unavailable", "The payment could not be verified right now. Retry later with the same id."),
  RATE_LIMITED("rate_limited", "Too many requests. Retry after the indicated delay."),
  SSRF_BLOCKED("ssrf_blocked", "Private or internal URLs are not allowed."),
  INVALID_REQUEST("invalid_request", "The request parameters are invalid.");

  private final String code;
  private final String hint;

  DenialReason(String code, String hint) {
    this.code = code;
    this.hint = hint;
  }

  public String code() {
    return code;
  }

  public String hint() {
    return hint;
  }
}
