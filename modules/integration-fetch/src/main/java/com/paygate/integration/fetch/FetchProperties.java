package com.paygate.integration.fetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fetch")
public class FetchProperties {
  private long timeoutMs = 15000L;
  private int maxRetries = 2;
  private long backoffMs = 500L;
  private long maxBackoffMs = 4000L;
  private boolean exponentialBackoff = true;
  private int maxRedirects = 5;
  private List<String> allowedSchemes = new ArrayList<>(FetchPolicy.DEFAULT_ALLOWED_SCHEMES);
  private List<String> blockedHostPatterns =
      new ArrayList<>(FetchPolicy.DEFAULT_BLOCKED_HOST_PATTERNS);
  private Proxy proxy = new Proxy();

  public FetchPolicy toPolicy() {
    return new FetchPolicy(
        new LinkedHashSet<>(allowedSchemes),
        blockedHostPatterns,
        Duration.ofMillis(timeoutMs),
        maxRetries,
        Duration.ofMillis(backoffMs),
        Duration.ofMillis(maxBackoffMs),
        exponentialBackoff,
        maxRedirects);
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public long getBackoffMs() {
    return backoffMs;
  }

  public void setBackoffMs(long backoffMs) {
    this.backoffMs = backoffMs;
  }

  public long getMaxBackoffMs() {
    return maxBackoffMs;
  }

  public void setMaxBackoffMs(long maxBackoffMs) {
    this.maxBackoffMs = maxBackoffMs;
  }

  public boolean isExponentialBackoff() {
    return exponentialBackoff;
  }

  public void setExponentialBackoff(boolean exponentialBackoff) {
    this.exponentialBackoff = exponentialBackoff;
  }

  public int getMaxRedirects() {
    return maxRedirects;
  }

  public void setMaxRedirects(int maxRedirects) {
    this.maxRedirects = maxRedirects;
  }

  public List<String> getAllowedSchemes() {
    return allowedSchemes;
  }

  public void setAllowedSchemes(List<String> allowedSchemes) {
    this.allowedSchemes = allowedSchemes;
  }

  public List<String> getBlockedHostPatterns() {
    return blockedHostPatterns;
  }

  public void setBlockedHostPatterns(List<String> blockedHostPatterns) {
    this.blockedHostPatterns = blockedHostPatterns;
  }

  public Proxy getProxy() {
    return proxy;
  }

  public void setProxy(Proxy proxy) {
    this.proxy = proxy;
  }

  public static class Proxy {
    private String host = "";
    private int port = 0;
    private String username = "";
    private String password = "";
    private String country = "US";

    public boolean isConfigured() {
      return host != null && !host.isBlank() && port > 0;
    }

    public boolean hasCredentials() {
      return username != null && !username.isBlank();
    }

    public String getHost() {
      return host;
    }

    public void setHost(String host) {
      this.host = host;
    }

    public int getPort() {
      return port;
    }

    public void setPort(int port) {
      this.port = port;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(String username) {
      this.username = username;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(String password) {
      this.password = password;
    }

    public String getCountry() {
      return country;
    }

    public void setCountry(String country) {
      this.country = country;
    }
  }
}
