package com.paygate.integration.fetch;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/** Buffers at most {@code maxBytes} of a body and cancels the stream once more arrives. */
final class CappedBodySubscriber implements HttpResponse.BodySubscriber<CappedBody> {
  private final long maxBytes;
  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private final CompletableFuture<CappedBody> result = new CompletableFuture<>();
  private Flow.Subscription subscription;
  private long bytesRead;

  CappedBodySubscriber(long maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be > 0");
    }
    this.maxBytes = maxBytes;
  }

  static HttpResponse.BodyHandler<CappedBody> handler(long maxBytes) {
    return responseInfo -> new CappedBodySubscriber(maxBytes);
  }

  @Override
  public CompletionStage<CappedBody> getBody() {
    return result;
  }

  @Override
  public void onSubscribe(Flow.Subscription subscription) {
    this.subscription = subscription;
    subscription.request(1);
  }

  @Override
  public void onNext(List<ByteBuffer> items) {
    if (result.isDone()) {
      return;
    }
    for (ByteBuffer item : items) {
      int available = item.remaining();
      int take = (int) Math.min(available, maxBytes - bytesRead);
      byte[] chunk = new byte[take];
      item.get(chunk);
      buffer.write(chunk, 0, take);
      bytesRead += take;
      if (take < available) {
        subscription.cancel();
        result.complete(body(true));
        return;
      }
    }
    subscription.request(1);
  }

  @Override
  public void onError(Throwable throwable) {
    result.completeExceptionally(throwable);
  }

  @Override
  public void onComplete() {
    result.complete(body(false));
  }

  private CappedBody body(boolean truncated) {
    return new CappedBody(buffer.toString(StandardCharsets.UTF_8), bytesRead, truncated);
  }
}
