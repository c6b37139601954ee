package com.github.spud.sample.ai.orchestrator.infrastructure.ai;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallException;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCaller;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentResponse;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

/**
 * 基于 Spring AI ChatClient 的 agent 调用
 * <p>
 * profile 中的逻辑模型名通过 app.orchestrator.agent.models 映射为供应商模型名
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatClientAgentCaller implements AgentCaller {

  private final ChatClient chatClient;
  private final OrchestratorProperties properties;

  @Override
  public AgentResponse call(AgentRequest request, CancellationToken token) {
    token.throwIfCancelled();
    ChatOptions options = toOptions(request.getProfile());
    log.debug("Calling agent: model={}, attempt={}, promptLength={}", options.getModel(),
      request.getAttempt(), request.getPrompt().length());
    try {
      String content = chatClient.prompt()
        .user(request.getPrompt())
        .options(options)
        .call()
        .content();
      token.throwIfCancelled();
      return AgentResponse.of(content);
    } catch (OrchestrationCancelledException e) {
      throw e;
    } catch (Exception e) {
      if (token.isCancelled()) {
        throw new OrchestrationCancelledException("Agent call cancelled", e);
      }
      throw new AgentCallException("Agent call failed: " + e.getMessage(), e);
    }
  }

  ChatOptions toOptions(AgentProfile profile) {
    ChatOptions.Builder builder = ChatOptions.builder();
    if (profile == null) {
      return builder.build();
    }
    if (profile.getModel() != null) {
      builder.model(properties.getAgent().getModels()
        .getOrDefault(profile.getModel(), profile.getModel()));
    }
    if (profile.getTemperature() != null) {
      builder.temperature(profile.getTemperature());
    }
    if (profile.getMaxTokens() != null) {
      builder.maxTokens(profile.getMaxTokens());
    }
    return builder.build();
  }
}
