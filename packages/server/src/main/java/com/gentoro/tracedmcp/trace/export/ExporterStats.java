package com.gentoro.tracedmcp.trace.export;

import java.util.LinkedHashMap;
import java.util.Map;

/** Exporter counters, exposed on the health endpoint and in logs. */
public final class ExporterStats {
  private final int buffered;
  private final long exported;
  private final long dropped;
  private final long failedBatches;

  public ExporterStats(int buffered, long exported, long dropped, long failedBatches) {
    this.buffered = buffered;
    this.exported = exported;
    this.dropped = dropped;
    this.failedBatches = failedBatches;
  }

  public int buffered() {
    return buffered;
  }

  public long exported() {
    return exported;
  }

  public long dropped() {
    return dropped;
  }

  public long failedBatches() {
    return failedBatches;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("buffered", buffered);
    m.put("exported", exported);
    m.put("dropped", dropped);
    m.put("failedBatches", failedBatches);
    return m;
  }

  @Override
  public String toString() {
    return "ExporterStats" + toMap();
  }
}
