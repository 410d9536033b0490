package com.paygate.gateapi.run;

public record WebFetchResult(
    String url, int status, String text, long contentLength, String proxyCountry) {}
