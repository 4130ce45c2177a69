package com.gentoro.tracedmcp;

import com.gentoro.tracedmcp.actuator.ActuatorService;
import com.gentoro.tracedmcp.exception.ExecutionException;
import com.gentoro.tracedmcp.exception.StateException;
import com.gentoro.tracedmcp.http.EmbeddedJettyServer;
import com.gentoro.tracedmcp.mcp.McpServer;
import com.gentoro.tracedmcp.mcp.McpServerSettings;
import com.gentoro.tracedmcp.rpc.ContextPropagationMiddleware;
import com.gentoro.tracedmcp.rpc.JsonRpcParser;
import com.gentoro.tracedmcp.rpc.McpMethodRouter;
import com.gentoro.tracedmcp.rpc.RequestSpanMiddleware;
import com.gentoro.tracedmcp.rpc.RpcDispatcher;
import com.gentoro.tracedmcp.tools.ToolRegistry;
import com.gentoro.tracedmcp.trace.SpanRecorder;
import com.gentoro.tracedmcp.trace.TraceContextCodec;
import com.gentoro.tracedmcp.trace.TraceContextStore;
import com.gentoro.tracedmcp.trace.TracerProviderFactory;
import com.gentoro.tracedmcp.trace.TracingSettings;
import com.gentoro.tracedmcp.trace.export.BatchingSpanProcessor;
import com.gentoro.tracedmcp.trace.export.sink.SpanExporterFactory;
import com.gentoro.tracedmcp.weather.RandomWeatherDataSource;
import com.gentoro.tracedmcp.weather.WeatherDataSource;
import com.gentoro.tracedmcp.weather.WeatherTools;
import io.modelcontextprotocol.spec.McpSchema;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.apache.commons.configuration2.Configuration;

/**
 * Application object: wires configuration, tracing, tools and the HTTP transport, and owns their
 * lifecycle. Nothing here is a global singleton; tests create as many instances as they need.
 */
public class TracedMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(TracedMcp.class);

  private Configuration configuration;
  private Function<String, String> environment;
  private final StartupParameters startupParameters;

  private TracingSettings tracingSettings;
  private McpServerSettings mcpSettings;
  private SpanExporter spanExporter;
  private BatchingSpanProcessor spanProcessor;
  private SdkTracerProvider tracerProvider;
  private SpanRecorder recorder;
  private ToolRegistry toolRegistry;
  private TraceContextStore sessionStore;
  private RpcDispatcher dispatcher;
  private EmbeddedJettyServer httpServer;

  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public TracedMcp(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  /** Use an already loaded configuration, typically from tests. */
  public TracedMcp(Configuration configuration, Function<String, String> environment) {
    this.startupParameters = null;
    this.configuration = configuration;
    this.environment = environment;
  }

  public void initialize() {
    if (configuration == null) {
      ConfigurationProvider provider = new ConfigurationProvider(startupParameters.configFile());
      this.configuration = provider.config();
      this.environment = provider.environment();
    }
    com.gentoro.tracedmcp.logging.LoggingService.applyConfiguration(configuration);

    this.tracingSettings = TracingSettings.from(configuration, environment);
    this.mcpSettings = McpServerSettings.from(configuration);

    this.spanExporter = createSpanExporter();
    this.spanProcessor = BatchingSpanProcessor.create(spanExporter, tracingSettings);
    this.tracerProvider =
        TracerProviderFactory.create(
            tracingSettings, mcpSettings.identity().version(), spanProcessor);
    this.recorder = new SpanRecorder(tracerProvider);
    log.info(
        "Tracing service '{}' exporting through '{}'",
        tracingSettings.serviceName(),
        tracingSettings.exporterType());

    this.toolRegistry = WeatherTools.registerAll(new ToolRegistry(), createWeatherDataSource());
    this.sessionStore = new TraceContextStore(mcpSettings.maxSessions());
    this.dispatcher =
        new RpcDispatcher(
            new JsonRpcParser(),
            List.of(
                new ContextPropagationMiddleware(new TraceContextCodec(), sessionStore),
                new RequestSpanMiddleware(recorder, Set.of(McpSchema.METHOD_TOOLS_CALL))),
            new McpMethodRouter(
                toolRegistry,
                recorder,
                sessionStore,
                mcpSettings.identity(),
                mcpSettings.structuredResults()));

    this.httpServer = new EmbeddedJettyServer(this);
    httpServer.prepare();
    try {
      new ActuatorService(spanProcessor).register(httpServer.getContextHandler());
      new McpServer(this).register();
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new ExecutionException("Could not start http server", e);
    }
  }

  protected SpanExporter createSpanExporter() {
    return SpanExporterFactory.create(tracingSettings.exporterType(), configuration, environment);
  }

  protected WeatherDataSource createWeatherDataSource() {
    return new RandomWeatherDataSource();
  }

  /** Block until the JVM is asked to stop, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "traced-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stop accepting requests, then flush the exporter within the configured timeout. Safe to call
   * multiple times; executed only once.
   */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down");
    try {
      if (httpServer != null) httpServer.stop();
    } finally {
      try {
        if (spanProcessor != null) spanProcessor.shutdown(tracingSettings.shutdownTimeout());
        if (tracerProvider != null) tracerProvider.shutdown();
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("TracedMcp not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public TracingSettings tracingSettings() {
    return tracingSettings;
  }

  public McpServerSettings mcpSettings() {
    return mcpSettings;
  }

  public SpanExporter spanExporter() {
    return spanExporter;
  }

  public BatchingSpanProcessor spanProcessor() {
    return spanProcessor;
  }

  public SdkTracerProvider tracerProvider() {
    return tracerProvider;
  }

  public SpanRecorder recorder() {
    return recorder;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }

  public TraceContextStore sessionStore() {
    return sessionStore;
  }

  public RpcDispatcher dispatcher() {
    return dispatcher;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
