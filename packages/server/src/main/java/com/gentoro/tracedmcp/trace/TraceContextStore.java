package com.gentoro.tracedmcp.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Remembers the most recent propagated trace context of every MCP session, so that follow-up
 * requests of a session that arrive without a {@code traceparent} header still join the caller's
 * trace.
 *
 * <p>The number of tracked sessions is bounded; the least recently used session is forgotten
 * first.
 */
public class TraceContextStore {
  private static final org.slf4j.Logger log =
      com.gentoro.tracedmcp.logging.LoggingService.getLogger(TraceContextStore.class);

  private static final Object NO_CONTEXT = new Object();

  private final Map<String, Object> sessions;

  public TraceContextStore(int maxSessions) {
    final int capacity = Math.max(1, maxSessions);
    this.sessions =
        Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, true) {
              @Override
              protected boolean removeEldestEntry(Map.Entry<String, Object> eldest) {
                boolean evict = size() > capacity;
                if (evict) log.debug("Evicting session {}", eldest.getKey());
                return evict;
              }
            });
  }

  /** Open a new session and return its id. */
  public String createSession() {
    String id = UUID.randomUUID().toString();
    sessions.put(id, NO_CONTEXT);
    log.debug("Created session {}", id);
    return id;
  }

  public boolean hasSession(String sessionId) {
    return sessionId != null && sessions.containsKey(sessionId);
  }

  /** Store {@code context} for a known session. Root contexts and unknown sessions are ignored. */
  public void remember(String sessionId, TraceContext context) {
    if (sessionId == null || context == null || context.isRoot()) return;
    synchronized (sessions) {
      if (!sessions.containsKey(sessionId)) return;
      sessions.put(sessionId, context);
    }
    log.debug("Stored trace context for session {}", sessionId);
  }

  public Optional<TraceContext> lookup(String sessionId) {
    if (sessionId == null) return Optional.empty();
    Object value = sessions.get(sessionId);
    return value instanceof TraceContext ctx ? Optional.of(ctx) : Optional.empty();
  }

  /** Close a session. Returns false when it was not known. */
  public boolean removeSession(String sessionId) {
    if (sessionId == null) return false;
    boolean removed = sessions.remove(sessionId) != null;
    if (removed) log.debug("Cleared session {}", sessionId);
    return removed;
  }

  public int size() {
    return sessions.size();
  }
}
