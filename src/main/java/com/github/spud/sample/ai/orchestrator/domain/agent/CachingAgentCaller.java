package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.KeyValueStore;
import com.github.spud.sample.ai.orchestrator.infrastructure.util.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

/**
 * Agent 响应缓存 相同 profile + prompt 直接返回缓存结果
 * <p>
 * 命中时返回的响应 {@link AgentResponse#isCached()} 为 true
 */
@Slf4j
public class CachingAgentCaller implements AgentCaller {

  static final String DEFAULT_KEY_PREFIX = "agent:";

  private final AgentCaller delegate;
  private final KeyValueStore store;
  private final Duration ttl;
  private final String keyPrefix;

  public CachingAgentCaller(AgentCaller delegate, KeyValueStore store, Duration ttl) {
    this(delegate, store, ttl, DEFAULT_KEY_PREFIX);
  }

  public CachingAgentCaller(AgentCaller delegate, KeyValueStore store, Duration ttl,
    String keyPrefix) {
    this.delegate = delegate;
    this.store = store;
    this.ttl = ttl;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public AgentResponse call(AgentRequest request, CancellationToken token) {
    String key = buildKey(request);
    Optional<AgentResponse> cached = lookup(key);
    if (cached.isPresent()) {
      return cached.get();
    }
    AgentResponse response = delegate.call(request, token);
    try {
      store.put(key, response.getText(), ttl);
      log.debug("Cached agent response for key: {}", key);
    } catch (Exception e) {
      log.warn("Failed to cache agent response: {}", e.getMessage());
    }
    return response;
  }

  private Optional<AgentResponse> lookup(String key) {
    try {
      Optional<String> cached = store.get(key);
      if (cached.isPresent()) {
        log.debug("Agent response cache hit for key: {}", key);
        return Optional.of(AgentResponse.cached(cached.get()));
      }
    } catch (Exception e) {
      log.warn("Failed to read agent response from cache: {}", e.getMessage());
    }
    return Optional.empty();
  }

  private String buildKey(AgentRequest request) {
    String raw = JsonUtils.toJson(request.getProfile()) + "|" + request.getPrompt();
    return keyPrefix + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
  }
}
