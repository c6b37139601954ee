package com.github.spud.sample.ai.orchestrator.domain.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.infrastructure.store.InMemoryKeyValueStore;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CachingAgentCallerTest {

  private AtomicInteger calls;
  private CachingAgentCaller caller;

  private InMemoryKeyValueStore store;
  private AgentCaller delegate;

  @BeforeEach
  void setUp() {
    calls = new AtomicInteger();
    store = new InMemoryKeyValueStore();
    delegate = (request, token) ->
      AgentResponse.of(request.getPrompt() + "#" + calls.incrementAndGet());
    caller = new CachingAgentCaller(delegate, store, Duration.ofMinutes(5));
  }

  @Test
  void identicalRequestsHitCache() {
    AgentProfile profile = AgentProfile.of("fast-small", 0.7);

    AgentResponse first = caller.call(AgentRequest.of("hello", profile), CancellationToken.none());
    AgentResponse second = caller.call(AgentRequest.of("hello", profile), CancellationToken.none());

    assertThat(first.getText()).isEqualTo("hello#1");
    assertThat(first.isCached()).isFalse();
    assertThat(second.getText()).isEqualTo(first.getText());
    assertThat(second.isCached()).isTrue();
    assertThat(calls).hasValue(1);
  }

  @Test
  void profileIsPartOfKey() {
    caller.call(AgentRequest.of("hello", AgentProfile.of("fast-small", 0.7)),
      CancellationToken.none());
    caller.call(AgentRequest.of("hello", AgentProfile.of("fast-small", 0.2)),
      CancellationToken.none());

    assertThat(calls).hasValue(2);
  }

  @Test
  void keyPrefixSeparatesCaches() {
    AgentProfile profile = AgentProfile.of("fast-small", 0.7);
    CachingAgentCaller proxyCaller = new CachingAgentCaller(delegate, store, Duration.ofMinutes(5),
      "proxy:");

    caller.call(AgentRequest.of("hello", profile), CancellationToken.none());
    AgentResponse proxied = proxyCaller.call(AgentRequest.of("hello", profile),
      CancellationToken.none());

    assertThat(proxied.isCached()).isFalse();
    assertThat(calls).hasValue(2);
    assertThat(proxyCaller.call(AgentRequest.of("hello", profile), CancellationToken.none())
      .isCached()).isTrue();
  }
}
