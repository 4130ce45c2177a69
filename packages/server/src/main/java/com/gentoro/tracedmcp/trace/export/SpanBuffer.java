package com.gentoro.tracedmcp.trace.export;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO of finished spans shared by request threads (producers) and the export worker
 * (consumer).
 *
 * <p>{@link #offer} never waits: when the buffer is full the {@link OverflowPolicy} decides which
 * span is discarded and {@link #dropped()} is incremented. Once {@link #close() closed}, every offer
 * is rejected and counted as dropped.
 */
public final class SpanBuffer<T> {
  private final ArrayDeque<T> queue;
  private final int capacity;
  private final OverflowPolicy policy;
  private long dropped;
  private boolean closed;
  private int wakeThreshold = Integer.MAX_VALUE;
  private boolean wakeRequested;

  public SpanBuffer(int capacity, OverflowPolicy policy) {
    if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
    this.capacity = capacity;
    this.policy = Objects.requireNonNull(policy, "policy");
    this.queue = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  /** Returns false when a span (this one or the oldest) had to be dropped. */
  public synchronized boolean offer(T span) {
    Objects.requireNonNull(span, "span");
    if (closed) {
      dropped++;
      return false;
    }
    boolean accepted = true;
    if (queue.size() >= capacity) {
      dropped++;
      if (policy == OverflowPolicy.DROP_NEWEST) {
        return false;
      }
      queue.pollFirst();
      accepted = false;
    }
    queue.addLast(span);
    if (queue.size() >= wakeThreshold) {
      notifyAll();
    }
    return accepted;
  }

  /** Remove up to {@code max} spans in FIFO order. */
  public synchronized List<T> drain(int max) {
    if (queue.isEmpty() || max <= 0) return Collections.emptyList();
    int n = Math.min(max, queue.size());
    List<T> batch = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      batch.add(queue.pollFirst());
    }
    return batch;
  }

  /**
   * Wait until {@code batchSize} spans are buffered, the timeout elapses, or {@link #wakeUp()} is
   * called; then drain up to {@code batchSize} spans (possibly none).
   */
  public synchronized List<T> awaitBatch(int batchSize, long timeout, TimeUnit unit)
      throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    wakeThreshold = batchSize;
    try {
      while (queue.size() < batchSize && !wakeRequested && !closed) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) break;
        TimeUnit.NANOSECONDS.timedWait(this, remaining);
      }
    } finally {
      wakeThreshold = Integer.MAX_VALUE;
      wakeRequested = false;
    }
    return drain(batchSize);
  }

  /** Release a thread blocked in {@link #awaitBatch}. */
  public synchronized void wakeUp() {
    wakeRequested = true;
    notifyAll();
  }

  /** Stop accepting spans. Already buffered spans stay drainable. */
  public synchronized void close() {
    closed = true;
    wakeRequested = true;
    notifyAll();
  }

  public synchronized boolean isClosed() {
    return closed;
  }

  public synchronized int size() {
    return queue.size();
  }

  public synchronized boolean isEmpty() {
    return queue.isEmpty();
  }

  public synchronized long dropped() {
    return dropped;
  }

  /** Account for spans discarded outside the buffer (e.g. left over at shutdown). */
  public synchronized void recordDropped(long count) {
    dropped += count;
  }

  public int capacity() {
    return capacity;
  }

  public OverflowPolicy policy() {
    return policy;
  }
}
