package com.paygate.gateapi.run;

import com.paygate.integration.fetch.FetchOptions;
import com.paygate.integration.fetch.FetchResponse;
import com.paygate.integration.fetch.OutboundFetchClient;
import java.util.Map;

public class WebFetchService {
  private static final Map<String, String> BROWSER_HEADERS =
      Map.of(
          "User-Agent",
          "Mozilla/5.0 (Linux; Android 14; Pixel 8) AppleWebKit/537.36 (KHTML, like Gecko)"
              + " Chrome/124.0 Mobile Safari/537.36",
          "Accept",
          "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
          "Accept-Language",
          "en-US,en;q=0.9");

  private final OutboundFetchClient fetchClient;
  private final int maxTextLength;
  private final String proxyCountry;

  public WebFetchService(OutboundFetchClient fetchClient, int maxTextLength, String proxyCountry) {
    if (maxTextLength <= 0) {
      throw new IllegalArgumentException("maxTextLength must be > 0");
    }
    this.fetchClient = fetchClient;
    this.maxTextLength = maxTextLength;
    this.proxyCountry = proxyCountry;
  }

  /** Fetches the page and caps its text; throws {@code FetchException} once retries are spent. */
  public WebFetchResult fetch(String url) {
    FetchResponse response =
        fetchClient.fetch(
            url, FetchOptions.get(BROWSER_HEADERS).withMaxBodyBytes(maxBodyBytes()));
    String body = response.body();
    String text = body.length() > maxTextLength ? body.substring(0, maxTextLength) : body;
    long contentLength =
        response.truncated()
            ? response.declaredContentLength().orElse(body.length())
            : body.length();
    return new WebFetchResult(url, response.statusCode(), text, contentLength, proxyCountry);
  }

  // a UTF-8 char is at most 4 bytes, so this always covers maxTextLength chars
  long maxBodyBytes() {
    return maxTextLength * 4L;
  }
}
