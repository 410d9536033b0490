package com.paygate.integration.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpJsonRpcClientTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private MockWebServer server;
  private HttpJsonRpcClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    client =
        new HttpJsonRpcClient(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
            objectMapper,
            new ChainRpcConfig(server.url("/rpc").uri(), Duration.ofMillis(500)));
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldPostJsonRpcEnvelopeAndReturnResult() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"status\":\"0x1\"}}"));

    JsonNode result = client.call("eth_getTransactionReceipt", List.of("0xabc"));

    assertEquals("0x1", result.get("status").asText());
    RecordedRequest recorded = server.takeRequest();
    assertEquals("POST", recorded.getMethod());
    assertEquals("/rpc", recorded.getPath());
    assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
    JsonNode sent = objectMapper.readTree(recorded.getBody().readUtf8());
    assertEquals("2.0", sent.get("jsonrpc").asText());
    assertEquals("eth_getTransactionReceipt", sent.get("method").asText());
    assertEquals("0xabc", sent.get("params").get(0).asText());
    assertTrue(sent.get("id").isNumber());
  }

  @Test
  void shouldReturnNullNodeForNullResult() {
    server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));

    JsonNode result = client.call("getTransaction", List.of("sig"));

    assertTrue(result.isNull());
  }

  @Test
  void shouldRaiseOnErrorObject() {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"Invalid param\"}}"));

    JsonRpcException ex =
        assertThrows(JsonRpcException.class, () -> client.call("getTransaction", List.of("x")));

    assertEquals(-32602, ex.rpcErrorCode());
    assertTrue(ex.getMessage().contains("Invalid param"));
  }

  @Test
  void shouldRaiseOnHttpErrorStatus() {
    server.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));

    JsonRpcException ex =
        assertThrows(JsonRpcException.class, () -> client.call("getTransaction", List.of("x")));

    assertEquals(429, ex.httpStatus());
    assertTrue(ex.isRateLimited());
  }

  @Test
  void shouldRaiseOnMalformedBody() {
    server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

    JsonRpcException ex =
        assertThrows(JsonRpcException.class, () -> client.call("getTransaction", List.of("x")));

    assertEquals(JsonRpcException.IO_FAILURE_STATUS, ex.httpStatus());
  }

  @Test
  void shouldRaiseWhenResultMissing() {
    server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":1}"));

    assertThrows(JsonRpcException.class, () -> client.call("getTransaction", List.of("x")));
  }

  @Test
  void shouldRaiseOnTimeout() {
    server.enqueue(
        new MockResponse()
            .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}")
            .setHeadersDelay(2, TimeUnit.SECONDS));

    JsonRpcException ex =
        assertThrows(JsonRpcException.class, () -> client.call("getTransaction", List.of("x")));

    assertTrue(ex.getMessage().contains("timed out"));
  }

  @Test
  void shouldTimeOutWhenBodyTricklesAfterHeaders() {
    server.enqueue(
        new MockResponse()
            .setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}" + " ".repeat(60))
            .throttleBody(10, 1, TimeUnit.SECONDS));

    JsonRpcException ex =
        assertTimeoutPreemptively(
            Duration.ofSeconds(3),
            () ->
                assertThrows(
                    JsonRpcException.class, () -> client.call("getTransaction", List.of("x"))));

    assertTrue(ex.getMessage().contains("timed out"));
    assertEquals(JsonRpcException.IO_FAILURE_STATUS, ex.httpStatus());
  }
}
