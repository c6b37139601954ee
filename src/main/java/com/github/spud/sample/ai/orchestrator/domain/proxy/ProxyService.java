package com.github.spud.sample.ai.orchestrator.domain.proxy;

import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallerFactory;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentResponse;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfig;
import com.github.spud.sample.ai.orchestrator.domain.config.OrchestrationConfigService;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.session.MalformedRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 一次性 agent 调用，不建会话，结果按 prompt 缓存
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProxyService {

  static final String KEY_PREFIX = "proxy:";

  private final AgentCallerFactory agentCallerFactory;
  private final OrchestrationConfigService configService;

  public AgentResponse call(String prompt) {
    if (!StringUtils.hasText(prompt)) {
      throw new MalformedRequestException("Missing prompt");
    }
    OrchestrationConfig config = configService.effective();
    AgentResponse response = agentCallerFactory.createCaching(config, KEY_PREFIX)
      .call(AgentRequest.of(prompt, config.agentProfile(OrchestrationConfig.DEFAULT_AGENT)),
        CancellationToken.none());
    log.info("Proxy call completed: cached={}, promptLength={}", response.isCached(),
      prompt.length());
    return response;
  }
}
