package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.github.spud.sample.ai.orchestrator.domain.kernel.BackoffRetry;
import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;
import com.github.spud.sample.ai.orchestrator.domain.kernel.OrchestrationCancelledException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps an {@link AgentCaller} with exponential backoff retry.
 */
@Slf4j
@RequiredArgsConstructor
public class RetryingAgentCaller implements AgentCaller {

  private final AgentCaller delegate;
  private final BackoffRetry retry;
  private final int maxAttempts;
  private final Duration baseDelay;

  @Override
  public AgentResponse call(AgentRequest request, CancellationToken token) {
    try {
      return retry.execute(() -> delegate.call(request, token), maxAttempts, baseDelay, token);
    } catch (OrchestrationCancelledException | AgentCallException e) {
      throw e;
    } catch (Exception e) {
      throw new AgentCallException("Agent call failed after " + maxAttempts + " attempts", e);
    }
  }
}
