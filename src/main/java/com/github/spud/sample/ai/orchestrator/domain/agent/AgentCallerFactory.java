package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.kernel.BackoffRetry;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.KeyValueStore;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 为一次会话组装 agent 调用链：基础调用 → 重试 →（可选）响应缓存
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentCallerFactory {

  private final AgentCaller agentCaller;
  private final BackoffRetry backoffRetry;
  private final OrchestratorProperties properties;
  private final KeyValueStore store;

  public AgentCaller create(OrchestrationConfig config) {
    AgentCaller caller = retrying();

    OrchestrationConfig.Caching caching = config.getCaching();
    if (caching != null && caching.isEnabled()) {
      log.debug("Agent response caching enabled, ttl={}s", caching.getTtl());
      caller = new CachingAgentCaller(caller, store, Duration.ofSeconds(caching.getTtl()));
    }
    return caller;
  }

  /**
   * 不论 caching.enabled 如何都带缓存，键带上给定前缀，用于一次性代理调用
   */
  public AgentCaller createCaching(OrchestrationConfig config, String keyPrefix) {
    OrchestrationConfig.Caching caching = config.getCaching();
    long ttlSeconds = caching != null ? caching.getTtl() : OrchestrationConfig.Caching.DEFAULT_TTL;
    return new CachingAgentCaller(retrying(), store, Duration.ofSeconds(ttlSeconds), keyPrefix);
  }

  private AgentCaller retrying() {
    OrchestratorProperties.Retry retry = properties.getAgent().getRetry();
    return new RetryingAgentCaller(agentCaller, backoffRetry, retry.getMaxAttempts(),
      retry.getBaseDelay());
  }
}
