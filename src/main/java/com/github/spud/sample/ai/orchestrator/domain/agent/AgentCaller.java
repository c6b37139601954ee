package com.github.spud.sample.ai.orchestrator.domain.agent;

import com.github.spud.sample.ai.orchestrator.domain.kernel.CancellationToken;

/**
 * "Call an agent, get a response" collaborator used by every orchestration stage.
 * <p>
 * Implementations must tolerate being retried and should honour the cancellation token
 * where the underlying transport allows it. Timeouts are the implementation's concern.
 */
@FunctionalInterface
public interface AgentCaller {

  AgentResponse call(AgentRequest request, CancellationToken token);
}
