package com.gentoro.tracedmcp.trace.export;

import com.gentoro.tracedmcp.trace.TracingSettings;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.ReadWriteSpan;
import io.opentelemetry.sdk.trace.ReadableSpan;
import io.opentelemetry.sdk.trace.SpanProcessor;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link SpanProcessor} that buffers ended spans in a bounded {@link SpanBuffer} and hands them to
 * an OpenTelemetry {@link SpanExporter} in batches from a dedicated daemon thread.
 *
 * <p>A batch is sent as soon as {@code batchSize} spans are buffered or when {@code
 * flushInterval} elapses. Ending a span never blocks on the exporter: a full buffer discards a span
 * according to the {@link OverflowPolicy} and counts it. Failed batches are logged and dropped;
 * there is no retry.
 */
public class BatchingSpanProcessor implements SpanProcessor {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(BatchingSpanProcessor.class);

  static final Duration DEFAULT_EXPORT_TIMEOUT = Duration.ofSeconds(30);

  private final SpanExporter exporter;
  private final SpanBuffer<SpanData> buffer;
  private final int batchSize;
  private final Duration flushInterval;
  private final Duration shutdownTimeout;
  private final Duration exportTimeout;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private final AtomicLong exported = new AtomicLong();
  private final AtomicLong failedBatches = new AtomicLong();
  private final Object exportLock = new Object();
  private volatile boolean running;
  private Thread worker;

  public BatchingSpanProcessor(
      SpanExporter exporter,
      int queueSize,
      int batchSize,
      Duration flushInterval,
      Duration shutdownTimeout,
      OverflowPolicy overflowPolicy) {
    this(
        exporter,
        queueSize,
        batchSize,
        flushInterval,
        shutdownTimeout,
        overflowPolicy,
        DEFAULT_EXPORT_TIMEOUT);
  }

  public BatchingSpanProcessor(
      SpanExporter exporter,
      int queueSize,
      int batchSize,
      Duration flushInterval,
      Duration shutdownTimeout,
      OverflowPolicy overflowPolicy,
      Duration exportTimeout) {
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.buffer = new SpanBuffer<>(queueSize, overflowPolicy);
    this.batchSize = Math.max(1, Math.min(batchSize, queueSize));
    this.flushInterval = Objects.requireNonNull(flushInterval, "flushInterval");
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    this.exportTimeout = Objects.requireNonNull(exportTimeout, "exportTimeout");
  }

  /** Create and start a processor sized from {@code settings}. */
  public static BatchingSpanProcessor create(SpanExporter exporter, TracingSettings settings) {
    BatchingSpanProcessor processor =
        new BatchingSpanProcessor(
            exporter,
            settings.queueSize(),
            settings.batchSize(),
            settings.flushInterval(),
            settings.shutdownTimeout(),
            settings.overflowPolicy());
    processor.start();
    return processor;
  }

  /** Start the export worker. Calling it again has no effect. */
  public void start() {
    if (!started.compareAndSet(false, true)) return;
    running = true;
    worker = new Thread(this::runLoop, "span-exporter");
    worker.setDaemon(true);
    worker.start();
    log.info(
        "Span exporter started: exporter={}, queueSize={}, batchSize={}, flushInterval={}ms, overflow={}",
        exporterName(),
        buffer.capacity(),
        batchSize,
        flushInterval.toMillis(),
        buffer.policy());
  }

  @Override
  public void onStart(Context parentContext, ReadWriteSpan span) {}

  @Override
  public boolean isStartRequired() {
    return false;
  }

  @Override
  public void onEnd(ReadableSpan span) {
    if (span == null || !span.getSpanContext().isSampled()) return;
    if (buffer.offer(span.toSpanData())) return;
    if (buffer.isClosed()) {
      log.debug("Exporter is shut down; dropping span {}", span.getSpanContext().getSpanId());
      return;
    }
    long dropped = buffer.dropped();
    if (dropped == 1 || dropped % 1000 == 0) {
      log.warn(
          "Span buffer full (capacity {}); {} span(s) dropped so far under {}",
          buffer.capacity(),
          dropped,
          buffer.policy());
    }
  }

  @Override
  public boolean isEndRequired() {
    return true;
  }

  public ExporterStats stats() {
    return new ExporterStats(buffer.size(), exported.get(), buffer.dropped(), failedBatches.get());
  }

  /** Buffer accessor for tests and diagnostics. */
  SpanBuffer<SpanData> buffer() {
    return buffer;
  }

  /** Export everything buffered right now on the calling thread. */
  @Override
  public CompletableResultCode forceFlush() {
    long failedBefore = failedBatches.get();
    List<SpanData> batch;
    while (!(batch = buffer.drain(batchSize)).isEmpty()) {
      exportBatch(batch, exportTimeout);
    }
    return failedBatches.get() == failedBefore
        ? CompletableResultCode.ofSuccess()
        : CompletableResultCode.ofFailure();
  }

  @Override
  public CompletableResultCode shutdown() {
    shutdown(shutdownTimeout);
    return CompletableResultCode.ofSuccess();
  }

  /**
   * Stop accepting spans, let the worker finish its current batch, then export what is left within
   * {@code timeout}. Spans still buffered at the deadline are counted as dropped. Only the first
   * call has an effect.
   */
  public void shutdown(Duration timeout) {
    if (!shutdown.compareAndSet(false, true)) return;
    long deadline = System.nanoTime() + timeout.toNanos();
    running = false;
    buffer.close();
    Thread w = worker;
    if (w != null) {
      try {
        TimeUnit.NANOSECONDS.timedJoin(w, Math.max(1L, deadline - System.nanoTime()));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      if (w.isAlive()) {
        log.warn("Span export worker did not stop in time; interrupting");
        w.interrupt();
      }
    }

    if (w == null || !w.isAlive()) {
      while (!buffer.isEmpty() && System.nanoTime() < deadline) {
        exportBatch(
            buffer.drain(batchSize),
            Duration.ofNanos(Math.max(1L, deadline - System.nanoTime())));
      }
    }
    List<SpanData> leftover = buffer.drain(Integer.MAX_VALUE);
    if (!leftover.isEmpty()) {
      buffer.recordDropped(leftover.size());
      log.warn("Discarding {} buffered span(s) at shutdown", leftover.size());
    }
    CompletableResultCode closed = exporter.shutdown();
    closed.join(Math.max(1L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    if (!closed.isSuccess()) {
      log.warn("Span exporter {} did not shut down cleanly", exporterName());
    }
    log.info("Span exporter stopped: {}", stats());
  }

  private void runLoop() {
    while (running) {
      try {
        List<SpanData> batch =
            buffer.awaitBatch(batchSize, flushInterval.toNanos(), TimeUnit.NANOSECONDS);
        if (!batch.isEmpty()) {
          exportBatch(batch, exportTimeout);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (RuntimeException e) {
        log.error("Unexpected failure in span export loop", e);
      }
    }
    log.debug("Span export worker exiting");
  }

  private void exportBatch(List<SpanData> batch, Duration timeout) {
    if (batch.isEmpty()) return;
    synchronized (exportLock) {
      CompletableResultCode result;
      try {
        result = exporter.export(batch).join(timeout.toNanos(), TimeUnit.NANOSECONDS);
      } catch (RuntimeException e) {
        log.warn(
            "Exporter {} failed to export {} span(s); batch dropped",
            exporterName(),
            batch.size(),
            e);
        failedBatches.incrementAndGet();
        return;
      }
      if (result.isSuccess()) {
        exported.addAndGet(batch.size());
        log.debug("Exported {} span(s) to {}", batch.size(), exporterName());
      } else {
        failedBatches.incrementAndGet();
        log.warn(
            "Exporter {} rejected {} span(s){}; batch dropped",
            exporterName(),
            batch.size(),
            result.isDone() ? "" : " (timed out)");
      }
    }
  }

  private String exporterName() {
    return exporter.getClass().getSimpleName();
  }
}
