package com.gentoro.tracedmcp.rpc;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.tracedmcp.tools.Tool;
import com.gentoro.tracedmcp.tools.ToolDescriptor;
import com.gentoro.tracedmcp.tools.ToolInvocation;
import com.gentoro.tracedmcp.tools.ToolRegistry;
import com.gentoro.tracedmcp.tools.ToolSchema;
import com.gentoro.tracedmcp.trace.SpanAttributes;
import com.gentoro.tracedmcp.trace.SpanRecorder;
import com.gentoro.tracedmcp.trace.TraceContextCodec;
import com.gentoro.tracedmcp.trace.TraceContextStore;
import com.gentoro.tracedmcp.trace.export.BatchingSpanProcessor;
import com.gentoro.tracedmcp.trace.export.OverflowPolicy;
import com.gentoro.tracedmcp.utility.JacksonUtility;
import com.gentoro.tracedmcp.weather.RandomWeatherDataSource;
import com.gentoro.tracedmcp.weather.WeatherTools;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.ErrorCodes;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RpcDispatcherTest {
  private static final String TRACEPARENT =
      "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01";
  private static final AttributeKey<String> WEATHER_LOCATION =
      AttributeKey.stringKey(WeatherTools.ATTR_LOCATION);

  private InMemorySpanExporter spanExporter;
  private final List<SdkTracerProvider> tracerProviders = new ArrayList<>();
  private TraceContextStore sessions;

  @BeforeEach
  void setUp() {
    spanExporter = InMemorySpanExporter.create();
    sessions = new TraceContextStore(16);
  }

  @AfterEach
  void tearDown() {
    tracerProviders.forEach(SdkTracerProvider::close);
  }

  private SpanRecorder recorder(SpanProcessor processor) {
    SdkTracerProvider tracerProvider =
        SdkTracerProvider.builder().addSpanProcessor(processor).build();
    tracerProviders.add(tracerProvider);
    return new SpanRecorder(tracerProvider);
  }

  private RpcDispatcher dispatcher(
      SpanRecorder recorder, ToolRegistry registry, ServerIdentity identity, boolean structured) {
    return new RpcDispatcher(
        new JsonRpcParser(),
        List.of(
            new ContextPropagationMiddleware(new TraceContextCodec(), sessions),
            new RequestSpanMiddleware(recorder, Set.of(McpSchema.METHOD_TOOLS_CALL))),
        new McpMethodRouter(registry, recorder, sessions, identity, structured));
  }

  private RpcDispatcher dispatcher(ToolRegistry registry) {
    return dispatcher(
        recorder(SimpleSpanProcessor.create(spanExporter)),
        registry,
        new ServerIdentity("weather-assistant", "1.0.0", "Ask about the weather."),
        false);
  }

  private RpcDispatcher weatherDispatcher() {
    return dispatcher(weatherRegistry());
  }

  private static ToolRegistry weatherRegistry() {
    return WeatherTools.registerAll(new ToolRegistry(), new RandomWeatherDataSource());
  }

  private SpanData onlySpan() {
    List<SpanData> spans = spanExporter.getFinishedSpanItems();
    assertEquals(1, spans.size());
    return spans.get(0);
  }

  private static byte[] body(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  private static byte[] call(Object id, String tool, String arguments) {
    String idJson = id instanceof String ? "\"" + id + "\"" : String.valueOf(id);
    return body(
        "{\"jsonrpc\":\"2.0\",\"id\":"
            + idJson
            + ",\"method\":\"tools/call\",\"params\":{\"name\":\""
            + tool
            + "\",\"arguments\":"
            + arguments
            + "}}");
  }

  private static Tool tool(String name, ToolBody body) {
    ToolDescriptor descriptor =
        ToolDescriptor.builder()
            .name(name)
            .description("Test tool " + name)
            .inputSchema(ToolSchema.builder().type(ToolSchema.Type.OBJECT).build())
            .build();
    return new Tool() {
      @Override
      public ToolDescriptor descriptor() {
        return descriptor;
      }

      @Override
      public JsonNode execute(ToolInvocation invocation) {
        return body.run();
      }
    };
  }

  private interface ToolBody {
    JsonNode run();
  }

  @Test
  @DisplayName("get_weather joins the caller's trace as a child of its span")
  void toolCallJoinsCallerTrace() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(
                call(1, "get_weather", "{\"location\":\"Paris\"}"),
                Map.of("traceparent", TRACEPARENT));

    assertEquals(RpcOutcome.OK, outcome.httpStatus());
    JsonNode body = outcome.body();
    assertFalse(body.has("error"));
    assertEquals(1, body.get("id").asInt());
    JsonNode result = body.get("result");
    assertEquals("Paris", result.get("location").asText());

    SpanData span = onlySpan();
    assertEquals("get_weather", span.getName());
    assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", span.getTraceId());
    assertEquals("00f067aa0ba902b7", span.getParentSpanId());
    assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
    assertEquals("jsonrpc", span.getAttributes().get(SpanAttributes.RPC_SYSTEM));
    assertEquals("tools/call", span.getAttributes().get(SpanAttributes.RPC_METHOD));
    assertEquals("1", span.getAttributes().get(SpanAttributes.RPC_JSONRPC_REQUEST_ID));
    assertEquals("get_weather", span.getAttributes().get(SpanAttributes.MCP_TOOL_NAME));
    assertEquals(
        "{\"location\":\"Paris\"}", span.getAttributes().get(SpanAttributes.MCP_TOOL_INPUT));
    assertEquals(
        JacksonUtility.toJson(result), span.getAttributes().get(SpanAttributes.MCP_TOOL_OUTPUT));
    assertEquals("Paris", span.getAttributes().get(WEATHER_LOCATION));
  }

  @Test
  void resultIsHandlerOutputVerbatim() {
    JsonNode fixed = JsonNodeFactory.instance.objectNode().put("answer", 42);

    RpcOutcome outcome =
        dispatcher(new ToolRegistry().register(tool("answer", () -> fixed)))
            .dispatch(call("req-1", "answer", "{}"), Map.of());

    assertEquals(fixed, outcome.body().get("result"));
    assertEquals("req-1", outcome.body().get("id").asText());
    SpanData span = onlySpan();
    assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
    assertFalse(span.getParentSpanContext().isValid());
  }

  @Test
  void unknownToolIsInvalidParamsWithoutSpan() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(call(2, "get_tides", "{}"), Map.of("traceparent", TRACEPARENT));

    JsonNode error = outcome.body().get("error");
    assertEquals(ErrorCodes.INVALID_PARAMS, error.get("code").asInt());
    assertEquals("get_tides", error.get("data").get("tool").asText());
    assertEquals(2, outcome.body().get("id").asInt());
    assertTrue(spanExporter.getFinishedSpanItems().isEmpty());
  }

  @Test
  void missingNameOrArgumentsIsInvalidParams() {
    RpcDispatcher dispatcher = weatherDispatcher();

    RpcOutcome noName =
        dispatcher.dispatch(
            body("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{}}"),
            Map.of());
    RpcOutcome noArguments =
        dispatcher.dispatch(
            body(
                "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\","
                    + "\"params\":{\"name\":\"get_weather\"}}"),
            Map.of());

    assertEquals(ErrorCodes.INVALID_PARAMS, noName.body().get("error").get("code").asInt());
    assertEquals(ErrorCodes.INVALID_PARAMS, noArguments.body().get("error").get("code").asInt());
    assertTrue(spanExporter.getFinishedSpanItems().isEmpty());
  }

  @Test
  void schemaViolationsAreReportedAndSpanFails() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(call(5, "get_forecast", "{\"location\":\"Oslo\",\"days\":0}"), Map.of());

    JsonNode error = outcome.body().get("error");
    assertEquals(ErrorCodes.INVALID_PARAMS, error.get("code").asInt());
    assertEquals("$.days: must be >= 1", error.get("data").get("violations").get(0).asText());

    SpanData span = onlySpan();
    assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
    assertEquals("InvalidParams", span.getAttributes().get(SpanAttributes.ERROR_KIND));
    assertEquals(
        (long) ErrorCodes.INVALID_PARAMS,
        span.getAttributes().get(SpanAttributes.RPC_JSONRPC_ERROR_CODE));
  }

  @Test
  void handlerFailureIsExecutionFailed() {
    Tool broken =
        tool(
            "broken",
            () -> {
              throw new IllegalStateException("backend offline");
            });

    RpcOutcome outcome =
        dispatcher(new ToolRegistry().register(broken)).dispatch(call(6, "broken", "{}"), Map.of());

    JsonNode error = outcome.body().get("error");
    assertEquals(RpcException.EXECUTION_FAILED, error.get("code").asInt());
    assertEquals("broken", error.get("data").get("tool").asText());
    assertEquals("backend offline", error.get("data").get("detail").asText());
    SpanData span = onlySpan();
    assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
    assertEquals("ExecutionFailed", span.getAttributes().get(SpanAttributes.ERROR_KIND));
    assertEquals(
        (long) RpcException.EXECUTION_FAILED,
        span.getAttributes().get(SpanAttributes.RPC_JSONRPC_ERROR_CODE));
  }

  @Test
  void toolsListWithoutHeaderClosesRootSpan() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(body("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}"), Map.of());

    JsonNode tools = outcome.body().get("result").get("tools");
    assertEquals(2, tools.size());
    assertEquals("get_weather", tools.get(0).get("name").asText());
    assertEquals("object", tools.get(0).get("inputSchema").get("type").asText());
    assertEquals("location", tools.get(0).get("inputSchema").get("required").get(0).asText());
    assertEquals("get_forecast", tools.get(1).get("name").asText());
    assertEquals("object", tools.get(1).get("outputSchema").get("type").asText());

    SpanData span = onlySpan();
    assertEquals("tools/list", span.getName());
    assertFalse(span.getParentSpanContext().isValid());
    assertNotEquals("4bf92f3577b34da6a3ce929d0e0e4736", span.getTraceId());
    assertEquals(StatusCode.OK, span.getStatus().getStatusCode());
  }

  @Test
  void unknownMethodClosesSpanWithError() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(
                body("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"resources/list\"}"), Map.of());

    assertEquals(ErrorCodes.METHOD_NOT_FOUND, outcome.body().get("error").get("code").asInt());
    assertEquals(9, outcome.body().get("id").asInt());
    SpanData span = onlySpan();
    assertEquals("resources/list", span.getName());
    assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
    assertEquals("MethodNotFound", span.getAttributes().get(SpanAttributes.ERROR_KIND));
  }

  @Test
  void malformedBodyIsParseErrorWithNullId() {
    RpcOutcome outcome = weatherDispatcher().dispatch(body("{oops"), Map.of());

    assertEquals(RpcOutcome.BAD_REQUEST, outcome.httpStatus());
    assertEquals(ErrorCodes.PARSE_ERROR, outcome.body().get("error").get("code").asInt());
    assertTrue(outcome.body().get("id").isNull());
    assertTrue(spanExporter.getFinishedSpanItems().isEmpty());
  }

  @Test
  void nullIdIsParseError() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(body("{\"jsonrpc\":\"2.0\",\"id\":null,\"method\":\"ping\"}"), Map.of());

    assertEquals(RpcOutcome.BAD_REQUEST, outcome.httpStatus());
    assertEquals(ErrorCodes.PARSE_ERROR, outcome.body().get("error").get("code").asInt());
    assertTrue(outcome.body().get("id").isNull());
  }

  @Test
  void notificationProducesNoResponse() {
    RpcOutcome outcome =
        weatherDispatcher()
            .dispatch(
                body("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}"), Map.of());

    assertEquals(RpcOutcome.ACCEPTED, outcome.httpStatus());
    assertFalse(outcome.hasBody());
    assertEquals(1, spanExporter.getFinishedSpanItems().size());
  }

  @Test
  void initializeNegotiatesVersionAndOpensSession() {
    RpcDispatcher dispatcher = weatherDispatcher();

    RpcOutcome outcome =
        dispatcher.dispatch(
            body(
                "{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\","
                    + "\"params\":{\"protocolVersion\":\"2025-03-26\",\"capabilities\":{}}}"),
            Map.of("traceparent", TRACEPARENT));

    JsonNode result = outcome.body().get("result");
    assertEquals("2025-03-26", result.get("protocolVersion").asText());
    assertTrue(result.get("capabilities").has("tools"));
    assertEquals("weather-assistant", result.get("serverInfo").get("name").asText());
    assertEquals("1.0.0", result.get("serverInfo").get("version").asText());
    assertEquals("Ask about the weather.", result.get("instructions").asText());

    String sessionId = outcome.headers().get(RpcExchange.SESSION_HEADER);
    assertNotNull(sessionId);
    assertTrue(sessions.hasSession(sessionId));

    RpcOutcome unknownVersion =
        dispatcher.dispatch(
            body(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                    + "\"params\":{\"protocolVersion\":\"1999-01-01\"}}"),
            Map.of());
    assertEquals(
        "2025-06-18", unknownVersion.body().get("result").get("protocolVersion").asText());
  }

  @Test
  void sessionContextIsReusedWhenHeaderIsMissing() {
    RpcDispatcher dispatcher = weatherDispatcher();
    String sessionId =
        dispatcher
            .dispatch(
                body("{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"initialize\",\"params\":{}}"),
                Map.of("traceparent", TRACEPARENT))
            .headers()
            .get(RpcExchange.SESSION_HEADER);

    dispatcher.dispatch(
        call(1, "get_weather", "{\"location\":\"Rome\"}"), Map.of("mcp-session-id", sessionId));

    SpanData toolSpan = spanExporter.getFinishedSpanItems().get(1);
    assertEquals("get_weather", toolSpan.getName());
    assertEquals("4bf92f3577b34da6a3ce929d0e0e4736", toolSpan.getTraceId());
    assertEquals("00f067aa0ba902b7", toolSpan.getParentSpanId());
    assertEquals(sessionId, toolSpan.getAttributes().get(SpanAttributes.MCP_SESSION_ID));
  }

  @Test
  void concurrentCallsKeepTheirOwnContexts() throws Exception {
    RpcDispatcher dispatcher = weatherDispatcher();
    int calls = 16;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    Map<String, String> expectedLocationByTrace = new HashMap<>();
    List<Callable<RpcOutcome>> tasks = new ArrayList<>();
    for (int i = 0; i < calls; i++) {
      String traceId = String.format("%016x%016x", 0xabcL, i + 1L);
      String location = "city-" + i;
      expectedLocationByTrace.put(traceId, location);
      Map<String, String> headers =
          Map.of("traceparent", "00-" + traceId + "-" + String.format("%016x", i + 100L) + "-01");
      byte[] request = call(i, "get_weather", "{\"location\":\"" + location + "\"}");
      tasks.add(() -> dispatcher.dispatch(request, headers));
    }

    try {
      for (Future<RpcOutcome> f : pool.invokeAll(tasks)) {
        assertFalse(RpcMessages.isError(f.get().response()));
      }
    } finally {
      pool.shutdownNow();
    }

    List<SpanData> spans = spanExporter.getFinishedSpanItems();
    assertEquals(calls, spans.size());
    assertEquals(calls, spans.stream().map(SpanData::getTraceId).distinct().count());
    for (SpanData span : spans) {
      assertEquals(
          expectedLocationByTrace.get(span.getTraceId()),
          span.getAttributes().get(WEATHER_LOCATION));
    }
  }

  @Test
  void fullExportBufferDoesNotAffectResponses() {
    // never started, so nothing drains the single slot
    BatchingSpanProcessor tiny =
        new BatchingSpanProcessor(
            spanExporter,
            1,
            1,
            Duration.ofMinutes(1),
            Duration.ofSeconds(1),
            OverflowPolicy.DROP_NEWEST);
    RpcDispatcher dispatcher =
        dispatcher(
            recorder(tiny), weatherRegistry(), new ServerIdentity("w", "1.0.0", null), false);

    RpcOutcome first =
        dispatcher.dispatch(call(1, "get_weather", "{\"location\":\"A\"}"), Map.of());
    RpcOutcome second =
        dispatcher.dispatch(call(2, "get_weather", "{\"location\":\"B\"}"), Map.of());

    assertFalse(RpcMessages.isError(first.response()));
    assertFalse(RpcMessages.isError(second.response()));
    assertEquals("B", second.body().get("result").get("location").asText());
    assertEquals(1, tiny.stats().dropped());
    assertEquals(1, tiny.stats().buffered());
  }

  @Test
  void structuredResultsWrapOutput() throws Exception {
    RpcDispatcher dispatcher =
        dispatcher(
            recorder(SimpleSpanProcessor.create(spanExporter)),
            weatherRegistry(),
            new ServerIdentity("weather-assistant", "1.0.0", null),
            true);

    JsonNode result =
        dispatcher
            .dispatch(call(1, "get_weather", "{\"location\":\"Nice\"}"), Map.of())
            .body()
            .get("result");

    assertEquals("text", result.get("content").get(0).get("type").asText());
    assertEquals(
        "Nice",
        JacksonUtility.getJsonMapper()
            .readTree(result.get("content").get(0).get("text").asText())
            .get("location")
            .asText());
    assertEquals("Nice", result.get("structuredContent").get("location").asText());
    assertFalse(result.get("isError").asBoolean());
  }
}
