package com.github.spud.sample.ai.orchestrator.infrastructure.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable string key-value store backing session state and the persisted configuration
 * layer.
 */
public interface KeyValueStore {

  Optional<String> get(String key);

  void put(String key, String value);

  /**
   * Store a value that expires after {@code ttl}
   */
  void put(String key, String value, Duration ttl);
}
