package com.github.spud.sample.ai.orchestrator.infrastructure.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local store, the default when no Redis is configured
 * <p>
 * 过期条目在读取时淘汰，另外每 {@value #SWEEP_INTERVAL} 次写入整体清扫一次
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.orchestrator.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {

  static final int SWEEP_INTERVAL = 256;

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();
  private final AtomicLong writes = new AtomicLong();
  private final Clock clock;

  public InMemoryKeyValueStore() {
    this(Clock.systemUTC());
  }

  public InMemoryKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Optional<String> get(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.millis())) {
      entries.remove(key, entry);
      log.debug("Expired key evicted: {}", key);
      return Optional.empty();
    }
    return Optional.of(entry.value);
  }

  @Override
  public void put(String key, String value) {
    write(key, new Entry(value, 0L));
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    write(key, new Entry(value, clock.millis() + ttl.toMillis()));
  }

  int size() {
    return entries.size();
  }

  private void write(String key, Entry entry) {
    entries.put(key, entry);
    if (writes.incrementAndGet() % SWEEP_INTERVAL == 0) {
      sweep();
    }
  }

  private void sweep() {
    long now = clock.millis();
    int before = entries.size();
    entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
    log.debug("Swept expired keys: {} -> {}", before, entries.size());
  }

  private record Entry(String value, long expiresAt) {

    boolean isExpired(long now) {
      return expiresAt > 0 && now >= expiresAt;
    }
  }
}
