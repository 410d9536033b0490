package com.paygate.integration.fetch;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProxiedHttpClientFactory {
  private static final Logger log = LoggerFactory.getLogger(ProxiedHttpClientFactory.class);

  private ProxiedHttpClientFactory() {}

  public static HttpClient create(FetchProperties.Proxy proxy, Duration connectTimeout) {
    HttpClient.Builder builder =
        HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER);
    if (proxy == null || !proxy.isConfigured()) {
      log.info("outbound fetch proxy not configured, using direct connections");
      return builder.build();
    }

    builder.proxy(
        ProxySelector.of(InetSocketAddress.createUnresolved(proxy.getHost(), proxy.getPort())));
    if (proxy.hasCredentials()) {
      String username = proxy.getUsername();
      char[] password = proxy.getPassword() == null ? new char[0] : proxy.getPassword().toCharArray();
      builder.authenticator(
          new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
              if (getRequestorType() != RequestorType.PROXY) {
                return null;
              }
              return new PasswordAuthentication(username, password);
            }
          });
    }
    log.info(
        "outbound fetch proxy configured host={} port={} country={} authenticated={}",
        proxy.getHost(),
        proxy.getPort(),
        proxy.getCountry(),
        proxy.hasCredentials());
    return builder.build();
  }
}
