package com.github.spud.sample.ai.orchestrator.infrastructure.store;

import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Redis 键值存储
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.orchestrator.store.type", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStore {

  private static final String KEY_PREFIX = "orchestrator:";

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + key));
  }

  @Override
  public void put(String key, String value) {
    redisTemplate.opsForValue().set(KEY_PREFIX + key, value);
  }

  @Override
  public void put(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(KEY_PREFIX + key, value, ttl);
  }
}
