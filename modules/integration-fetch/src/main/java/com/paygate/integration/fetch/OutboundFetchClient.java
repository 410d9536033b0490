package com.paygate.integration.fetch;

import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OutboundFetchClient {
  private static final Logger log = LoggerFactory.getLogger(OutboundFetchClient.class);

  private static final String RETRY_COUNTER = "fetch.retry";
  private static final String EXHAUSTED_COUNTER = "fetch.exhausted";
  private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);
  static final long DEFAULT_MAX_BODY_BYTES = 10L * 1024 * 1024;

  private final HttpClient httpClient;
  private final FetchPolicy policy;
  private final SsrfGuard ssrfGuard;
  private final RetryBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public OutboundFetchClient(
      HttpClient httpClient, FetchPolicy policy, SsrfGuard ssrfGuard, MeterRegistry meterRegistry) {
    this(
        httpClient,
        policy,
        ssrfGuard,
        RetryBackoff.forPolicy(policy),
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  public OutboundFetchClient(
      HttpClient httpClient,
      FetchPolicy policy,
      SsrfGuard ssrfGuard,
      RetryBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
    this.ssrfGuard = Objects.requireNonNull(ssrfGuard, "ssrfGuard must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public FetchResponse fetch(String url) {
    return fetch(url, FetchOptions.get());
  }

  public FetchResponse fetch(String url, FetchOptions options) {
    URI target = ssrfGuard.check(url);
    FetchOptions effective = options == null ? FetchOptions.get() : options;
    Duration timeout = effective.timeout() != null ? effective.timeout() : policy.timeout();
    int maxRetries = effective.maxRetries() != null ? effective.maxRetries() : policy.maxRetries();
    int maxAttempts = maxRetries + 1;
    long maxBodyBytes =
        effective.maxBodyBytes() != null ? effective.maxBodyBytes() : DEFAULT_MAX_BODY_BYTES;

    int attempt = 1;
    while (true) {
      FetchException failure;
      try {
        HttpResponse<CappedBody> response =
            sendFollowingRedirects(target, effective, timeout, maxBodyBytes);
        if (response.statusCode() < 500) {
          CappedBody body = response.body();
          if (body.truncated()) {
            log.info(
                "outbound fetch body truncated host={} bytesRead={}",
                response.uri().getHost(),
                body.bytesRead());
          }
          return new FetchResponse(
              response.statusCode(),
              response.headers().map(),
              body.text(),
              response.uri(),
              attempt,
              body.truncated());
        }
        failure =
            new FetchException(
                FetchException.Kind.UPSTREAM_STATUS,
                "Upstream responded with HTTP " + response.statusCode(),
                attempt,
                response.statusCode(),
                null);
      } catch (HttpTimeoutException ex) {
        failure =
            new FetchException(
                FetchException.Kind.TIMEOUT,
                "Upstream did not respond within " + timeout.toMillis() + "ms",
                attempt,
                -1,
                ex);
      } catch (IOException ex) {
        failure =
            new FetchException(
                FetchException.Kind.NETWORK, "Failed to reach upstream host", attempt, -1, ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new FetchException(
            FetchException.Kind.INTERRUPTED, "Outbound fetch was interrupted", attempt, -1, ex);
      }

      if (attempt >= maxAttempts) {
        meterRegistry.counter(EXHAUSTED_COUNTER, "kind", failure.kind().name()).increment();
        log.warn(
            "outbound fetch exhausted host={} attempts={} kind={}",
            target.getHost(),
            attempt,
            failure.kind());
        throw failure;
      }

      Duration wait = backoff.delayAfterAttempt(attempt);
      meterRegistry.counter(RETRY_COUNTER, "kind", failure.kind().name()).increment();
      log.warn(
          "outbound fetch retry host={} attempt={} maxAttempts={} kind={} backoffMs={}",
          target.getHost(),
          attempt,
          maxAttempts,
          failure.kind(),
          wait.toMillis());
      sleep(wait);
      attempt++;
    }
  }

  // One deadline covers every redirect hop and the body of the final response.
  private HttpResponse<CappedBody> sendFollowingRedirects(
      URI target, FetchOptions options, Duration timeout, long maxBodyBytes)
      throws IOException, InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    HttpResponse.BodyHandler<CappedBody> bodyHandler = CappedBodySubscriber.handler(maxBodyBytes);
    URI current = target;
    String method = options.method();
    int redirects = 0;
    while (true) {
      HttpResponse<CappedBody> response =
          sendBefore(deadline, current, method, options.headers(), bodyHandler);
      if (!REDIRECT_STATUSES.contains(response.statusCode())) {
        return response;
      }
      String location = response.headers().firstValue("Location").orElse(null);
      if (location == null || location.isBlank()) {
        return response;
      }
      if (redirects >= policy.maxRedirects()) {
        throw new FetchException(
            FetchException.Kind.TOO_MANY_REDIRECTS,
            "Exceeded " + policy.maxRedirects() + " redirects");
      }
      URI next;
      try {
        next = current.resolve(location.trim());
      } catch (IllegalArgumentException ex) {
        throw new FetchException(
            FetchException.Kind.INVALID_URL, "Invalid redirect location", 0, -1, ex);
      }
      current = ssrfGuard.check(next);
      if (response.statusCode() == 303
          || ((response.statusCode() == 301 || response.statusCode() == 302)
              && !"HEAD".equals(method))) {
        method = "GET";
      }
      redirects++;
    }
  }

  private HttpResponse<CappedBody> sendBefore(
      long deadline,
      URI uri,
      String method,
      Map<String, String> headers,
      HttpResponse.BodyHandler<CappedBody> bodyHandler)
      throws IOException, InterruptedException {
    long remaining = deadline - System.nanoTime();
    if (remaining <= 0) {
      throw new HttpTimeoutException("deadline passed before request to " + uri.getHost());
    }
    CompletableFuture<HttpResponse<CappedBody>> future =
        httpClient.sendAsync(
            buildRequest(uri, method, headers, Duration.ofNanos(remaining)), bodyHandler);
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new HttpTimeoutException("response from " + uri.getHost() + " not complete in time");
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof IOException ioException) {
        throw ioException;
      }
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IOException("Outbound request failed", cause);
    }
  }

  private static HttpRequest buildRequest(
      URI uri, String method, Map<String, String> headers, Duration timeout) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .method(method, HttpRequest.BodyPublishers.noBody());
    headers.forEach(builder::header);
    return builder.build();
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new FetchException(
          FetchException.Kind.INTERRUPTED,
          "Interrupted during outbound fetch backoff",
          0,
          -1,
          interrupted);
    }
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
