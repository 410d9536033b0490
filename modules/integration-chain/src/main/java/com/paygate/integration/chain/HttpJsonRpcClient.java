package com.paygate.integration.chain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

public class HttpJsonRpcClient {
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ChainRpcConfig config;
  private final AtomicLong requestIds = new AtomicLong();

  public HttpJsonRpcClient(HttpClient httpClient, ObjectMapper objectMapper, ChainRpcConfig config) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /** Returns the {@code result} member, which is a {@code NullNode} when the node has no data. */
  public JsonNode call(String method, List<?> params) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("jsonrpc", "2.0");
    payload.put("id", requestIds.incrementAndGet());
    payload.put("method", method);
    payload.set("params", objectMapper.valueToTree(params));

    String body;
    try {
      body = objectMapper.writeValueAsString(payload);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to serialize JSON-RPC request " + method, ex);
    }

    HttpRequest request =
        HttpRequest.newBuilder(config.endpoint())
            .timeout(config.timeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();
    HttpResponse<String> response = execute(request, method);
    return parseResult(method, response.body());
  }

  private HttpResponse<String> execute(HttpRequest request, String method) {
    // request timeout stops at the headers, the future deadline also bounds the body
    CompletableFuture<HttpResponse<String>> future =
        httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    HttpResponse<String> response;
    try {
      response = future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new JsonRpcException(
          "JSON-RPC " + method + " request was interrupted",
          JsonRpcException.IO_FAILURE_STATUS,
          null,
          ex);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw timedOut(method, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof HttpTimeoutException) {
        throw timedOut(method, cause);
      }
      throw new JsonRpcException(
          "Failed to call JSON-RPC " + method, JsonRpcException.IO_FAILURE_STATUS, null, cause);
    }

    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response;
    }
    throw new JsonRpcException(
        "JSON-RPC " + method + " failed with HTTP status=" + response.statusCode(),
        response.statusCode(),
        null);
  }

  private JsonRpcException timedOut(String method, Throwable cause) {
    return new JsonRpcException(
        "JSON-RPC " + method + " timed out after " + config.timeout().toMillis() + "ms",
        JsonRpcException.IO_FAILURE_STATUS,
        null,
        cause);
  }

  private JsonNode parseResult(String method, String responseBody) {
    JsonNode node;
    try {
      node = objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw new JsonRpcException(
          "Failed to parse JSON-RPC " + method + " response",
          JsonRpcException.IO_FAILURE_STATUS,
          null,
          ex);
    }
    if (node == null || !node.isObject()) {
      throw JsonRpcException.malformed("JSON-RPC " + method + " response is not an object");
    }
    JsonNode error = node.get("error");
    if (error != null && !error.isNull()) {
      Integer code = error.hasNonNull("code") ? error.get("code").intValue() : null;
      String message = error.path("message").asText("Unknown JSON-RPC error");
      throw new JsonRpcException(
          "JSON-RPC " + method + " error code=" + code + " message=" + message, 200, code);
    }
    if (!node.has("result")) {
      throw JsonRpcException.malformed("JSON-RPC " + method + " response missing field: result");
    }
    return node.get("result");
  }
}
