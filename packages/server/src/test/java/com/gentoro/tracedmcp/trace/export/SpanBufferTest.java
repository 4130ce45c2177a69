package com.gentoro.tracedmcp.trace.export;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class SpanBufferTest {

  @Test
  void dropNewestKeepsBufferedSpans() {
    SpanBuffer<String> buffer = new SpanBuffer<>(2, OverflowPolicy.DROP_NEWEST);

    assertTrue(buffer.offer("a"));
    assertTrue(buffer.offer("b"));
    assertFalse(buffer.offer("c"));

    assertEquals(1, buffer.dropped());
    assertEquals(List.of("a", "b"), buffer.drain(10));
  }

  @Test
  void dropOldestEvictsHead() {
    SpanBuffer<String> buffer = new SpanBuffer<>(2, OverflowPolicy.DROP_OLDEST);

    buffer.offer("a");
    buffer.offer("b");
    assertFalse(buffer.offer("c"));

    assertEquals(1, buffer.dropped());
    assertEquals(List.of("b", "c"), buffer.drain(10));
  }

  @Test
  void drainRespectsLimitAndOrder() {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_NEWEST);
    buffer.offer("a");
    buffer.offer("b");
    buffer.offer("c");

    assertEquals(List.of("a", "b"), buffer.drain(2));
    assertEquals(1, buffer.size());
    assertTrue(buffer.drain(0).isEmpty());
  }

  @Test
  void closedBufferRejectsAndCountsOffers() {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_OLDEST);
    buffer.offer("a");

    buffer.close();

    assertTrue(buffer.isClosed());
    assertFalse(buffer.offer("late"));
    assertFalse(buffer.offer("later"));
    assertEquals(2, buffer.dropped());
    assertEquals(List.of("a"), buffer.drain(10));
  }

  @Test
  void awaitBatchTimesOutWithPartialBatch() throws InterruptedException {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_NEWEST);
    buffer.offer("a");

    List<String> batch = buffer.awaitBatch(5, 20, TimeUnit.MILLISECONDS);

    assertEquals(1, batch.size());
    assertTrue(buffer.isEmpty());
  }

  @Test
  void awaitBatchReturnsOnceThresholdReached() throws Exception {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_NEWEST);
    Thread producer =
        new Thread(
            () -> {
              buffer.offer("a");
              buffer.offer("b");
            });

    long start = System.nanoTime();
    producer.start();
    List<String> batch = buffer.awaitBatch(2, 10, TimeUnit.SECONDS);
    producer.join();

    assertEquals(2, batch.size());
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  void wakeUpReleasesWaiter() throws Exception {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_NEWEST);
    Thread waker =
        new Thread(
            () -> {
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              buffer.wakeUp();
            });

    long start = System.nanoTime();
    waker.start();
    List<String> batch = buffer.awaitBatch(5, 10, TimeUnit.SECONDS);
    waker.join();

    assertTrue(batch.isEmpty());
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  void closeReleasesWaiter() throws Exception {
    SpanBuffer<String> buffer = new SpanBuffer<>(10, OverflowPolicy.DROP_NEWEST);
    Thread closer =
        new Thread(
            () -> {
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              buffer.close();
            });

    long start = System.nanoTime();
    closer.start();
    List<String> batch = buffer.awaitBatch(5, 10, TimeUnit.SECONDS);
    closer.join();

    assertTrue(batch.isEmpty());
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SpanBuffer<String>(0, OverflowPolicy.DROP_NEWEST));
  }
}
