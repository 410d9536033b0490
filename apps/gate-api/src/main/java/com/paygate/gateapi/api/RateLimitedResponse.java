package com.paygate.gateapi.api;

public record RateLimitedResponse(String error, String reason, long retryAfterSeconds) {}
