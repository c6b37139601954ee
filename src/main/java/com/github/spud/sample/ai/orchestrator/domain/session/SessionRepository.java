package com.github.spud.sample.ai.orchestrator.domain.session;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.KeyValueStore;
import com.github.spud.sample.ai.orchestrator.infrastructure.util.JsonUtils;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * Session persistence over the key-value store: meta at {@code session:{id}:meta}, the event
 * log at {@code session:{id}:events}, both as JSON. Every write refreshes the session TTL.
 */
@Repository
public class SessionRepository {

  private final KeyValueStore store;
  private final Duration ttl;

  public SessionRepository(KeyValueStore store, OrchestratorProperties properties) {
    this.store = store;
    this.ttl = properties.getStore().getSessionTtl();
  }

  public Optional<SessionMeta> findMeta(String sessionId) {
    return store.get(metaKey(sessionId))
      .map(json -> JsonUtils.fromJson(json, SessionMeta.class));
  }

  public SessionMeta requireMeta(String sessionId) {
    return findMeta(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  public void saveMeta(SessionMeta meta) {
    store.put(metaKey(meta.getId()), JsonUtils.toJson(meta), ttl);
  }

  public EventLog loadEvents(String sessionId) {
    return store.get(eventsKey(sessionId))
      .map(json -> JsonUtils.fromJson(json, EventLog.class))
      .orElseGet(EventLog::new);
  }

  public void saveEvents(String sessionId, EventLog events) {
    store.put(eventsKey(sessionId), JsonUtils.toJson(events), ttl);
  }

  static String metaKey(String sessionId) {
    return "session:" + sessionId + ":meta";
  }

  static String eventsKey(String sessionId) {
    return "session:" + sessionId + ":events";
  }
}
