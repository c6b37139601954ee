package com.github.spud.sample.ai.orchestrator.infrastructure.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.orchestrator.application.config.OrchestratorProperties;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentCallException;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentProfile;
import com.github.spud.sample.ai.orchestrator.domain.agent.AgentRequest;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

class ChatClientAgentCallerTest {

  private ChatClient chatClient;
  private ChatClientAgentCaller caller;

  @BeforeEach
  void setUp() {
    chatClient = mock(ChatClient.class);
    OrchestratorProperties properties = new OrchestratorProperties();
    properties.getAgent().getModels().put("fast-small", "gpt-4o-mini");
    caller = new ChatClientAgentCaller(chatClient, properties);
  }

  @Test
  void mapsLogicalModelName() {
    ChatOptions options = caller.toOptions(AgentProfile.builder()
      .model("fast-small").temperature(0.3).maxTokens(256).build());

    assertThat(options.getModel()).isEqualTo("gpt-4o-mini");
    assertThat(options.getTemperature()).isEqualTo(0.3);
    assertThat(options.getMaxTokens()).isEqualTo(256);
  }

  @Test
  void unknownModelPassesThrough() {
    assertThat(caller.toOptions(AgentProfile.of("gpt-4.1", 0.5)).getModel()).isEqualTo("gpt-4.1");
  }

  @Test
  void providerFailureBecomesAgentCallException() {
    when(chatClient.prompt()).thenThrow(new IllegalStateException("401 Unauthorized"));

    assertThatThrownBy(() -> caller.call(AgentRequest.of("hi", new AgentProfile()),
      CancellationToken.none()))
      .isInstanceOf(AgentCallException.class)
      .hasMessageContaining("401 Unauthorized");
  }

  @Test
  void cancelledTokenSkipsCall() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    assertThatThrownBy(() -> caller.call(AgentRequest.of("hi", new AgentProfile()), token))
      .isInstanceOf(OrchestrationCancelledException.class);
    verifyNoInteractions(chatClient);
  }
}
