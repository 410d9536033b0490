package com.paygate.integration.fetch;

/** Response body read up to a byte cap; {@code truncated} is set when the upstream sent more. */
record CappedBody(String text, long bytesRead, boolean truncated) {}
