package com.paygate.gateapi.api;

public record VerificationFailureResponse(String error, String reason, String hint) {}
