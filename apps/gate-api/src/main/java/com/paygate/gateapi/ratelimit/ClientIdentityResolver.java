package com.paygate.gateapi.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

public class ClientIdentityResolver {
  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  private static final String UNKNOWN_CLIENT = "unknown";

  private final boolean trustForwardedFor;

  public ClientIdentityResolver(boolean trustForwardedFor) {
    this.trustForwardedFor = trustForwardedFor;
  }

  public String resolve(HttpServletRequest request) {
    if (trustForwardedFor) {
      String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
      if (forwarded != null && !forwarded.isBlank()) {
        String firstHop = forwarded.split(",", 2)[0].trim();
        if (!firstHop.isEmpty()) {
          return firstHop;
        }
      }
    }
    String remoteAddr = request.getRemoteAddr();
    return remoteAddr == null || remoteAddr.isBlank() ? UNKNOWN_CLIENT : remoteAddr;
  }
}
