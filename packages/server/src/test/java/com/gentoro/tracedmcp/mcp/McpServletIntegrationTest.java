package com.gentoro.tracedmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.tracedmcp.TracedMcp;
import com.gentoro.tracedmcp.trace.SpanAttributes;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class McpServletIntegrationTest {
  private static final MediaType JSON = MediaType.get("application/json");
  private static final String TRACEPARENT =
      "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";

  private final InMemorySpanExporter spanExporter = InMemorySpanExporter.create();
  private TracedMcp app;
  private OkHttpClient client;
  private String baseUrl;

  @BeforeEach
  void setUp() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("http.hostname", "127.0.0.1");
    cfg.addProperty("http.port", 0);
    cfg.addProperty("tracing.exporter.type", "none");
    cfg.addProperty("tracing.exporter.flush-interval-ms", 20);
    app =
        new TracedMcp(cfg, name -> null) {
          @Override
          protected SpanExporter createSpanExporter() {
            // the in-memory exporter forgets its spans when shut down
            return new SpanExporter() {
              @Override
              public CompletableResultCode export(Collection<SpanData> spans) {
                return spanExporter.export(spans);
              }

              @Override
              public CompletableResultCode flush() {
                return CompletableResultCode.ofSuccess();
              }

              @Override
              public CompletableResultCode shutdown() {
                return CompletableResultCode.ofSuccess();
              }
            };
          }
        };
    app.initialize();
    baseUrl = "http://127.0.0.1:" + app.httpServer().getPort();
    client = new OkHttpClient();
  }

  @AfterEach
  void tearDown() {
    app.shutdown();
  }

  private List<SpanData> awaitSpans(int count) throws InterruptedException {
    long deadline = System.nanoTime() + 5_000_000_000L;
    while (spanExporter.getFinishedSpanItems().size() < count && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    return spanExporter.getFinishedSpanItems();
  }

  private Response post(String json, Map<String, String> headers) throws IOException {
    Request.Builder builder =
        new Request.Builder().url(baseUrl + "/weather").post(RequestBody.create(json, JSON));
    headers.forEach(builder::header);
    return client.newCall(builder.build()).execute();
  }

  @Test
  void initializeThenTracedToolCall() throws Exception {
    String sessionId;
    try (Response response =
        post(
            "{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2025-06-18\"}}",
            Map.of())) {
      assertEquals(200, response.code());
      sessionId = response.header("Mcp-Session-Id");
      assertNotNull(sessionId);
    }

    try (Response response =
        post(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"get_forecast\",\"arguments\":{\"location\":\"Lima\",\"days\":2}}}",
            Map.of("traceparent", TRACEPARENT, "Mcp-Session-Id", sessionId))) {
      assertEquals(200, response.code());
      assertTrue(response.header("Content-Type").startsWith("application/json"));
      JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body().string());
      assertEquals("2.0", body.get("jsonrpc").asText());
      assertEquals(1, body.get("id").asInt());
      assertEquals(2, body.get("result").get("items").size());
    }

    List<SpanData> spans = awaitSpans(2);
    SpanData toolSpan =
        spans.stream().filter(s -> s.getName().equals("get_forecast")).findFirst().orElseThrow();
    assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", toolSpan.getTraceId());
    assertEquals("00f067aa0ba902b7", toolSpan.getParentSpanId());
    assertEquals(2L, toolSpan.getAttributes().get(AttributeKey.longKey("weather.days")));
    assertEquals(
        "weather-assistant", toolSpan.getResource().getAttribute(SpanAttributes.SERVICE_NAME));
  }

  @Test
  void shutdownExportsBufferedSpans() throws Exception {
    try (Response response =
        post("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"ping\"}", Map.of())) {
      assertEquals(200, response.code());
    }

    app.shutdown();

    assertTrue(
        spanExporter.getFinishedSpanItems().stream().anyMatch(s -> s.getName().equals("ping")));
    assertEquals(0, app.spanProcessor().stats().buffered());
  }

  @Test
  void notificationIsAcceptedWithoutBody() throws Exception {
    try (Response response =
        post("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}", Map.of())) {
      assertEquals(202, response.code());
      assertEquals(0, response.body().bytes().length);
    }
  }

  @Test
  void malformedBodyIsBadRequest() throws Exception {
    try (Response response = post("{not json", Map.of())) {
      assertEquals(400, response.code());
      JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body().string());
      assertTrue(body.get("id").isNull());
      assertEquals(-32700, body.get("error").get("code").asInt());
    }
  }

  @Test
  void getIsNotAllowed() throws Exception {
    Request request = new Request.Builder().url(baseUrl + "/weather").get().build();
    try (Response response = client.newCall(request).execute()) {
      assertEquals(405, response.code());
      assertNotNull(response.header("Allow"));
    }
  }

  @Test
  void deleteEndsSessionOnce() throws Exception {
    String sessionId;
    try (Response response =
        post("{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\",\"params\":{}}", Map.of())) {
      sessionId = response.header("Mcp-Session-Id");
    }
    Request delete =
        new Request.Builder()
            .url(baseUrl + "/weather")
            .delete()
            .header("Mcp-Session-Id", sessionId)
            .build();

    try (Response first = client.newCall(delete).execute()) {
      assertEquals(200, first.code());
    }
    try (Response second = client.newCall(delete).execute()) {
      assertEquals(404, second.code());
    }
    assertFalse(app.sessionStore().hasSession(sessionId));
  }

  @Test
  void healthReportsExporterCounters() throws Exception {
    Request request = new Request.Builder().url(baseUrl + "/actuator/health").get().build();
    try (Response response = client.newCall(request).execute()) {
      assertEquals(200, response.code());
      JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body().string());
      assertEquals("UP", body.get("status").asText());
      assertTrue(body.get("exporter").has("dropped"));
    }
  }
}
